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

final class HashUtil {
    // Note: The unique table is probed for every created node, so these are kept as cheap as possible.
    // The memo hashes mix a little more, since their keys are dense node indices of a single diagram.

    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int key) {
        return key;
    }

    static int hash(int firstKey, int secondKey) {
        return (PRIME * firstKey) ^ secondKey;
    }

    static int hash(int firstKey, int secondKey, int thirdKey) {
        return firstKey + secondKey + thirdKey;
    }

    static int mixedHash(int firstKey, int secondKey, int thirdKey) {
        return (PRIME * ((PRIME * firstKey) ^ secondKey)) ^ thirdKey;
    }
}
