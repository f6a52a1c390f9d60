/* 
 * Copyright (C) 2024 STIMNOISE authors
 *
 * This File is part of STIMNOISE
 *
 * STIMNOISE is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * STIMNOISE is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with STIMNOISE.  If not, see <http://www.gnu.org/licenses/>.
 */
package stimnoise.configuration.parameters;

import stimnoise.utils.ConfigurationException;

import java.util.function.Predicate;

/**
 *
 * Base of simple parameters: name, hint and additional validation
 */
public abstract class ParameterImpl<P extends ParameterImpl<P>> implements Parameter<P> {
    protected String name;
    protected String hintText;
    protected Predicate<P> additionalValidation = p->true;

    protected ParameterImpl(String name) {
        this.name=name;
    }

    @Override
    public String getName(){
        return name;
    }

    @Override
    public String getHintText() {
        return hintText;
    }

    @Override
    public P setHint(String hint) {
        this.hintText = hint;
        return (P)this;
    }

    @Override
    public P addValidationFunction(Predicate<P> validationFunction) {
        this.additionalValidation = this.additionalValidation.and(validationFunction);
        return (P)this;
    }

    @Override
    public boolean isValid() {
        if (additionalValidation==null) return true;
        return additionalValidation.test((P)this);
    }

    @Override
    public P checkValid() {
        if (!isValid()) throw new ConfigurationException(getInvalidityMessage());
        return (P)this;
    }

    /**
     * @return message of the exception thrown by {@link #checkValid()}
     */
    protected String getInvalidityMessage() {
        return name+" is invalid ("+this+")";
    }

    /**
     * Copies hint and validation of this parameter to {@param other}
     */
    protected <Q extends ParameterImpl> Q transferProperties(Q other) {
        other.hintText = hintText;
        other.additionalValidation = additionalValidation;
        return other;
    }

    @Override
    public String toString() {
        return name;
    }
}
