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

import static de.tum.in.jobdd.Util.checkState;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates {@link Expression expressions} into canonical nodes of a {@link NodeTable}.
 *
 * <p>Sub-expressions are memoized by identity for the duration of one call, so shared sub-trees are only
 * translated once. Every memoized node stays on the work stack until the call returns.</p>
 */
final class ExpressionCompiler {
    private final NodeTable table;
    private final ApplyEngine engine;
    private final VariableRegistry registry;

    ExpressionCompiler(NodeTable table, ApplyEngine engine, VariableRegistry registry) {
        this.table = table;
        this.engine = engine;
        this.registry = registry;
    }

    /**
     * Returns the (unreferenced) node representing {@code expression}.
     *
     * @throws MalformedExpressionException
     *     if some operation in the expression is ill-formed.
     */
    int compile(Expression expression) {
        Map<Expression, Integer> memo = new IdentityHashMap<>();
        int stackSize = table.workStackSize();
        try {
            return compileRecursive(expression, memo);
        } finally {
            // Also restore the stack if an ill-formed operation was found half-way
            table.popWorkStack(table.workStackSize() - stackSize);
        }
    }

    /**
     * Returns the node of the variable with the given rank, i.e. the node which is true iff the variable is.
     */
    int variableNode(int rank) {
        return table.makeNode(rank, table.falseNode(), table.trueNode());
    }

    private int compileRecursive(Expression expression, Map<Expression, Integer> memo) {
        Integer cached = memo.get(expression);
        if (cached != null) {
            return cached;
        }

        int result;
        if (expression instanceof Expression.Constant) {
            result = table.terminal(((Expression.Constant) expression).value());
        } else if (expression instanceof Expression.Literal) {
            Variable variable = ((Expression.Literal) expression).variable();
            checkState(registry.contains(variable), "Variable %s is not registered with this manager", variable);
            result = variableNode(variable.rank());
        } else {
            Expression.Operation operation = (Expression.Operation) expression;
            operation.checkWellFormed();
            List<Expression> operands = operation.operands();

            int first = compileRecursive(operands.get(0), memo);
            switch (operation.connective()) {
                case NOT:
                    result = engine.not(first);
                    break;
                case ITE:
                    result = engine.ifThenElse(first, compileRecursive(operands.get(1), memo),
                            compileRecursive(operands.get(2), memo));
                    break;
                default:
                    BooleanOperator operator = operation.connective().operator();
                    assert operator != null;
                    result = engine.apply(operator, first, compileRecursive(operands.get(1), memo));
                    break;
            }
        }

        memo.put(expression, table.pushToWorkStack(result));
        return result;
    }
}
