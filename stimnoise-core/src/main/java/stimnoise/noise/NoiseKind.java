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
package stimnoise.noise;

import stimnoise.plugins.NoiseGenerator;
import stimnoise.plugins.plugins.noises.BinaryNoise;
import stimnoise.plugins.plugins.noises.NarrowbandNoise;
import stimnoise.plugins.plugins.noises.OneOverFNoise;
import stimnoise.plugins.plugins.noises.OrientedNoise;
import stimnoise.plugins.plugins.noises.WhiteNoise;
import stimnoise.utils.UnsupportedModeException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 *
 * Closed set of noise kinds. Each kind creates its own generator, with parameters left unset
 */
public enum NoiseKind {
    WHITE("white") {
        @Override
        public NoiseGenerator createGenerator() {
            return new WhiteNoise();
        }
    },
    NARROWBAND("narrowband") {
        @Override
        public NoiseGenerator createGenerator() {
            return new NarrowbandNoise();
        }
    },
    ONE_OVER_F("one_over_f") {
        @Override
        public NoiseGenerator createGenerator() {
            return new OneOverFNoise();
        }
    },
    PINK("pink") {
        @Override
        public NoiseGenerator createGenerator() {
            return OneOverFNoise.pink();
        }
    },
    BROWN("brown") {
        @Override
        public NoiseGenerator createGenerator() {
            return OneOverFNoise.brown();
        }
    },
    ORIENTED("oriented") {
        @Override
        public NoiseGenerator createGenerator() {
            return new OrientedNoise();
        }
    },
    BINARY("binary") {
        @Override
        public NoiseGenerator createGenerator() {
            return new BinaryNoise();
        }
        @Override
        public boolean isSpectral() {
            return false;
        }
    };

    private final String tag;

    NoiseKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public abstract NoiseGenerator createGenerator();

    /**
     * @return description of the noise, from its generator
     */
    public String getHintText() {
        return createGenerator().getHintText();
    }

    /**
     * @return whether the noise is synthesized in the frequency domain, which requires an even-numbered shape
     */
    public boolean isSpectral() {
        return true;
    }

    /**
     * @param tag e.g. "narrowband". Case-sensitive
     * @throws UnsupportedModeException if no kind has this tag
     */
    public static NoiseKind fromTag(String tag) {
        for (NoiseKind k : values()) if (k.tag.equals(tag)) return k;
        throw new UnsupportedModeException(tag, "Unsupported noise kind: "+tag+" (supported kinds: "+ Arrays.stream(values()).map(NoiseKind::getTag).collect(Collectors.joining(", "))+")");
    }

    @Override
    public String toString() {
        return tag;
    }
}
