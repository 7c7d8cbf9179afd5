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

import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Enumerates all assignments of the variables with ranks {@code 0} to {@code variableCount - 1}. The iterator
 * returns the same, modified {@link BitSet} on each call.
 */
final class Valuations implements Iterator<BitSet> {
    private final int length;
    private final BitSet next;
    private boolean first = true;
    private boolean hasNext = true;

    private Valuations(int length) {
        this.length = length;
        this.next = new BitSet(length);
    }

    static Iterable<BitSet> all(int variableCount) {
        return () -> new Valuations(variableCount);
    }

    @Override
    public boolean hasNext() {
        return hasNext;
    }

    @Override
    public BitSet next() {
        if (!hasNext) {
            throw new NoSuchElementException();
        }
        if (first) {
            first = false;
            hasNext = length > 0;
            return next;
        }
        int clear = next.nextClearBit(0);
        assert clear < length;
        next.clear(0, clear);
        next.set(clear);
        hasNext = next.cardinality() < length;
        return next;
    }
}
