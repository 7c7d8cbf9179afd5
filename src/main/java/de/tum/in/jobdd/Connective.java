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

import javax.annotation.Nullable;

/**
 * The connectives of {@link Expression.Operation operation} expressions, together with their arity.
 */
public enum Connective {
    NOT(1, null),
    AND(2, BooleanOperator.AND),
    OR(2, BooleanOperator.OR),
    XOR(2, BooleanOperator.XOR),
    IMPLIES(2, BooleanOperator.IMPLIES),
    EQUIVALENT(2, BooleanOperator.EQUIVALENCE),
    ITE(3, null);

    private final int arity;
    @Nullable
    private final BooleanOperator operator;

    Connective(int arity, @Nullable BooleanOperator operator) {
        this.arity = arity;
        this.operator = operator;
    }

    public int arity() {
        return arity;
    }

    /**
     * Returns the binary operator corresponding to this connective, or {@code null} for {@link #NOT} and
     * {@link #ITE}.
     */
    @Nullable
    public BooleanOperator operator() {
        return operator;
    }

    boolean evaluate(boolean[] values) {
        assert values.length == arity;
        switch (this) {
            case NOT:
                return !values[0];
            case ITE:
                return values[0] ? values[1] : values[2];
            default:
                assert operator != null;
                return operator.apply(values[0], values[1]);
        }
    }
}
