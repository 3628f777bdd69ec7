/* 
 * Copyright (C) 2025 Scopie developers
 *
 * This File is part of Scopie
 *
 * Scopie is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Scopie is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Scopie.  If not, see <http://www.gnu.org/licenses/>.
 */
package scopie.processing.fft;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Precomputed tables of a radix-2 transform of length n: bit-reversal permutation and twiddle factors exp(-2πik/N2) of every butterfly stage N2 = 2, 4, ..., n, stored stage after stage (n-1 entries).
 * Plans are immutable and shared by all transforms of the same length.
 */
public final class FFTPlan {
    public final static Logger logger = LoggerFactory.getLogger(FFTPlan.class);
    private final static Map<Integer, FFTPlan> PLANS = new ConcurrentHashMap<>();

    final int n;
    final int[] bitReverse;
    final double[] twiddleRe, twiddleIm;

    /**
     * @param n transform length
     * @return the plan for {@param n}, created on first request
     * @throws IllegalArgumentException if {@param n} is not a power of two
     */
    public static FFTPlan get(int n) {
        if (!isPowerOfTwo(n)) throw new IllegalArgumentException("FFT length must be a power of two, got: "+n);
        return PLANS.computeIfAbsent(n, FFTPlan::new);
    }

    public static boolean isPowerOfTwo(int n) {
        return n>0 && (n & (n-1)) == 0;
    }

    private FFTPlan(int n) {
        this.n = n;
        bitReverse = new int[n];
        int bits = Integer.numberOfTrailingZeros(n);
        if (bits>0) {
            for (int i = 0; i<n; ++i) bitReverse[i] = Integer.reverse(i) >>> (32 - bits);
        }
        twiddleRe = new double[n-1];
        twiddleIm = new double[n-1];
        int offset = 0;
        for (int n2 = 2; n2<=n; n2<<=1) {
            int half = n2>>1;
            for (int k = 0; k<half; ++k) {
                double angle = -2 * Math.PI * k / n2;
                twiddleRe[offset+k] = Math.cos(angle);
                twiddleIm[offset+k] = Math.sin(angle);
            }
            offset += half;
        }
        logger.debug("created FFT plan of length {}", n);
    }

    public int size() {
        return n;
    }

    /**
     * @return bit-reversed index of {@param i}
     */
    public int bitReverse(int i) {
        return bitReverse[i];
    }

    public int twiddleCount() {
        return twiddleRe.length;
    }

    @Override
    public String toString() {
        return "FFTPlan["+n+"]";
    }
}
