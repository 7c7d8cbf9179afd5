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

/**
 * The binary Boolean connectives supported by {@link ApplyEngine#apply(BooleanOperator, int, int)}. Each operator
 * is given by its truth table, bit {@code 2a + b} holds the value for the inputs {@code a} and {@code b}.
 */
public enum BooleanOperator {
    AND(0b1000),
    OR(0b1110),
    XOR(0b0110),
    IMPLIES(0b1011),
    EQUIVALENCE(0b1001);

    private final int truthTable;

    BooleanOperator(int truthTable) {
        this.truthTable = truthTable;
    }

    public boolean apply(boolean first, boolean second) {
        return (truthTable & (1 << ((first ? 2 : 0) + (second ? 1 : 0)))) != 0;
    }

    public boolean isCommutative() {
        return apply(true, false) == apply(false, true);
    }
}
