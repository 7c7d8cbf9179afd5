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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class UtilityTest {
    @Test
    public void testValuationsEnumerateAllAssignments() {
        int size = 10;
        Set<BitSet> seen = new HashSet<>();
        for (BitSet valuation : Valuations.all(size)) {
            assertThat(valuation.length() <= size, is(true));
            seen.add((BitSet) valuation.clone());
        }
        assertThat(seen.size(), is(1 << size));

        int count = 0;
        for (BitSet valuation : Valuations.all(0)) {
            assertThat(valuation.isEmpty(), is(true));
            count += 1;
        }
        assertThat(count, is(1));
    }

    @Test
    public void testNextPrime() {
        assertThat(Primes.nextPrime(0), is(2));
        assertThat(Primes.nextPrime(8), is(11));
        assertThat(Primes.nextPrime(13), is(13));
        assertThat(Primes.nextPrime(1000), is(1009));
    }

    @Test
    public void testMin() {
        assertThat(Util.min(3, 1, 2), is(1));
        assertThat(Util.min(1, 3, 0), is(0));
        assertThat(Util.min(2, 2, Integer.MAX_VALUE), is(2));
    }
}
