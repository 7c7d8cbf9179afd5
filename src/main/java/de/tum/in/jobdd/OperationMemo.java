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

import java.util.Arrays;

/**
 * Memo table of a single top-level operation, mapping up to three node handles to a result node. Uses open
 * addressing with linear probing on plain arrays.
 *
 * <p>Keys refer to node slots, which are re-used after a garbage collection. Hence the memo remembers the
 * {@link NodeTable#garbageCollectionCount() collection count} it was filled under and silently clears itself once
 * the table collected in between.</p>
 */
final class OperationMemo {
    private static final int NOT_A_NODE = NodeTable.NOT_A_NODE;

    private final NodeTable table;
    private long generation;
    private int[] keys;
    private int[] results;
    private int size = 0;

    OperationMemo(NodeTable table, int initialSize) {
        assert initialSize > 0;
        this.table = table;
        this.generation = table.garbageCollectionCount();
        int capacity = Integer.highestOneBit(Math.max(initialSize, 4) - 1) << 1;
        this.keys = new int[3 * capacity];
        this.results = new int[capacity];
    }

    /**
     * Returns the remembered result or {@link NodeTable#NOT_A_NODE} if there is none.
     */
    int lookup(int first, int second, int third) {
        invalidateIfCollected();
        int mask = results.length - 1;
        int position = HashUtil.mixedHash(first, second, third) & mask;
        while (true) {
            int result = results[position];
            if (result == NOT_A_NODE) {
                return NOT_A_NODE;
            }
            int keyIndex = 3 * position;
            if (keys[keyIndex] == first && keys[keyIndex + 1] == second && keys[keyIndex + 2] == third) {
                return result;
            }
            position = (position + 1) & mask;
        }
    }

    void put(int first, int second, int third, int result) {
        assert result != NOT_A_NODE;
        invalidateIfCollected();
        if (2 * (size + 1) > results.length) {
            grow();
        }
        if (insert(keys, results, first, second, third, result)) {
            size += 1;
        }
    }

    int size() {
        invalidateIfCollected();
        return size;
    }

    private void invalidateIfCollected() {
        long currentGeneration = table.garbageCollectionCount();
        if (generation != currentGeneration) {
            generation = currentGeneration;
            Arrays.fill(results, NOT_A_NODE);
            size = 0;
        }
    }

    private void grow() {
        int[] oldKeys = keys;
        int[] oldResults = results;
        int[] newKeys = new int[2 * oldKeys.length];
        int[] newResults = new int[2 * oldResults.length];
        for (int position = 0; position < oldResults.length; position++) {
            if (oldResults[position] != NOT_A_NODE) {
                int keyIndex = 3 * position;
                insert(newKeys, newResults, oldKeys[keyIndex], oldKeys[keyIndex + 1], oldKeys[keyIndex + 2],
                        oldResults[position]);
            }
        }
        keys = newKeys;
        results = newResults;
    }

    private static boolean insert(int[] keys, int[] results, int first, int second, int third, int result) {
        int mask = results.length - 1;
        int position = HashUtil.mixedHash(first, second, third) & mask;
        while (results[position] != NOT_A_NODE) {
            int keyIndex = 3 * position;
            if (keys[keyIndex] == first && keys[keyIndex + 1] == second && keys[keyIndex + 2] == third) {
                results[position] = result;
                return false;
            }
            position = (position + 1) & mask;
        }
        int keyIndex = 3 * position;
        keys[keyIndex] = first;
        keys[keyIndex + 1] = second;
        keys[keyIndex + 2] = third;
        results[position] = result;
        return true;
    }
}
