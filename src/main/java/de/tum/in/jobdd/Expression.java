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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * An immutable Boolean formula over {@link Variable variables}, used as input to
 * {@link ObddManager#compile(Expression)}. Expressions are plain trees and not hash-consed, equality is
 * structural.
 */
@SuppressWarnings("PMD.ShortMethodName")
public abstract class Expression {
    public static final Expression FALSE = new Constant(false);
    public static final Expression TRUE = new Constant(true);

    Expression() {
        // Only the nested classes may extend this
    }

    public static Expression constant(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Expression variable(Variable variable) {
        return new Literal(Objects.requireNonNull(variable));
    }

    public static Expression not(Expression operand) {
        return new Operation(Connective.NOT, List.of(operand));
    }

    public static Expression and(Expression left, Expression right) {
        return new Operation(Connective.AND, List.of(left, right));
    }

    public static Expression or(Expression left, Expression right) {
        return new Operation(Connective.OR, List.of(left, right));
    }

    public static Expression xor(Expression left, Expression right) {
        return new Operation(Connective.XOR, List.of(left, right));
    }

    public static Expression implies(Expression left, Expression right) {
        return new Operation(Connective.IMPLIES, List.of(left, right));
    }

    public static Expression equivalent(Expression left, Expression right) {
        return new Operation(Connective.EQUIVALENT, List.of(left, right));
    }

    public static Expression ifThenElse(Expression condition, Expression then, Expression otherwise) {
        return new Operation(Connective.ITE, List.of(condition, then, otherwise));
    }

    /**
     * Creates an operation without checking the operands. Ill-formed operations, i.e. with an operand count not
     * matching the {@link Connective#arity() arity} or with {@code null} operands, are only rejected when the
     * expression is evaluated or compiled.
     */
    public static Expression operation(Connective connective, Expression... operands) {
        return new Operation(Objects.requireNonNull(connective),
                Collections.unmodifiableList(new ArrayList<>(Arrays.asList(operands))));
    }

    /**
     * Evaluates this expression, where exactly the variables accepted by {@code assignment} are true.
     *
     * @throws MalformedExpressionException
     *     if some operation is ill-formed.
     */
    public abstract boolean evaluate(Predicate<Variable> assignment);

    /**
     * Returns all variables occurring in this expression, ordered by rank.
     */
    public Set<Variable> variables() {
        Set<Variable> variables = new TreeSet<>();
        gatherVariables(variables);
        return variables;
    }

    abstract void gatherVariables(Set<Variable> variables);

    public static final class Constant extends Expression {
        private final boolean value;

        Constant(boolean value) {
            this.value = value;
        }

        public boolean value() {
            return value;
        }

        @Override
        public boolean evaluate(Predicate<Variable> assignment) {
            return value;
        }

        @Override
        void gatherVariables(Set<Variable> variables) {
            // No variables in this leaf
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Constant)) {
                return false;
            }
            return value == ((Constant) object).value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class Literal extends Expression {
        private final Variable variable;

        Literal(Variable variable) {
            this.variable = variable;
        }

        public Variable variable() {
            return variable;
        }

        @Override
        public boolean evaluate(Predicate<Variable> assignment) {
            return assignment.test(variable);
        }

        @Override
        void gatherVariables(Set<Variable> variables) {
            variables.add(variable);
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Literal)) {
                return false;
            }
            return variable.equals(((Literal) object).variable);
        }

        @Override
        public int hashCode() {
            return variable.hashCode();
        }

        @Override
        public String toString() {
            return variable.toString();
        }
    }

    public static final class Operation extends Expression {
        private final Connective connective;
        private final List<Expression> operands;

        Operation(Connective connective, List<Expression> operands) {
            this.connective = connective;
            this.operands = operands;
        }

        public Connective connective() {
            return connective;
        }

        /**
         * The operands of this operation. The list is unmodifiable and, for ill-formed operations, may contain
         * {@code null}.
         */
        public List<Expression> operands() {
            return operands;
        }

        /**
         * Checks that the operand count matches the connective and no operand is {@code null}. Does not descend
         * into the operands.
         */
        void checkWellFormed() {
            if (operands.size() != connective.arity()) {
                throw new MalformedExpressionException(String.format("%s expects %d operand(s), got %d",
                        connective, connective.arity(), operands.size()), this);
            }
            // Operand lists may come from List.of, which rejects contains(null)
            for (Expression operand : operands) {
                if (operand == null) {
                    throw new MalformedExpressionException(String.format("%s has a null operand", connective), this);
                }
            }
        }

        @Override
        public boolean evaluate(Predicate<Variable> assignment) {
            checkWellFormed();
            boolean[] values = new boolean[operands.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = operands.get(i).evaluate(assignment);
            }
            return connective.evaluate(values);
        }

        @Override
        void gatherVariables(Set<Variable> variables) {
            for (Expression operand : operands) {
                if (operand != null) {
                    operand.gatherVariables(variables);
                }
            }
        }

        @Override
        public boolean equals(Object object) {
            if (this == object) {
                return true;
            }
            if (!(object instanceof Operation)) {
                return false;
            }
            Operation that = (Operation) object;
            return connective == that.connective && operands.equals(that.operands);
        }

        @Override
        public int hashCode() {
            return Objects.hash(connective, operands);
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder(connective.toString()).append('[');
            for (int i = 0; i < operands.size(); i++) {
                if (i > 0) {
                    builder.append(',');
                }
                builder.append(operands.get(i));
            }
            return builder.append(']').toString();
        }
    }
}
