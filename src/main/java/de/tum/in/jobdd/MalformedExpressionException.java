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
 * Thrown if an {@link Expression} cannot be interpreted, e.g. because an operation has the wrong number of
 * operands.
 */
public class MalformedExpressionException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final transient Expression expression;

    public MalformedExpressionException(String message, Expression expression) {
        super(message);
        this.expression = expression;
    }

    /**
     * The offending sub-expression.
     */
    public Expression expression() {
        return expression;
    }
}
