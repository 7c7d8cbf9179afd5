/*
 * This file is part of JOBDD.
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JOBDD is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JOBDD is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JOBDD. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jobdd;

import com.google.common.math.LongMath;

final class Primes {
    private Primes() {}

    /**
     * Returns the smallest prime which is bigger or equal to {@code value}.
     */
    static int nextPrime(int value) {
        if (value <= 2) {
            return 2;
        }
        int candidate = value % 2 == 0 ? value + 1 : value;
        while (!LongMath.isPrime(candidate)) {
            candidate += 2;
        }
        return candidate;
    }
}
