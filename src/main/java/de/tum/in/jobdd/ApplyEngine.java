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

/**
 * Recursive operations on node handles of a single {@link NodeTable}. All results are canonical since every node
 * is obtained through {@link NodeTable#makeNode(int, int, int)}.
 *
 * <p>Each top-level call pushes its arguments onto the work stack, uses a fresh {@link OperationMemo} and pops the
 * arguments again before returning. Intermediate results are kept on the work stack while the other cofactor is
 * computed. The returned node is <b>not</b> referenced, callers have to reference it (or push it onto the work
 * stack) before invoking another operation.</p>
 */
final class ApplyEngine {
    private static final int TRUE_NODE = NodeTable.TRUE_NODE;
    private static final int FALSE_NODE = NodeTable.FALSE_NODE;
    private static final int NOT_A_NODE = NodeTable.NOT_A_NODE;

    // Negations share the memo of the surrounding operation, this tag cannot collide with a node handle
    private static final int NEGATION_TAG = Integer.MIN_VALUE;

    private final NodeTable table;
    private final int memoInitialSize;

    ApplyEngine(NodeTable table, int memoInitialSize) {
        this.table = table;
        this.memoInitialSize = memoInitialSize;
    }

    private OperationMemo newMemo() {
        return new OperationMemo(table, memoInitialSize);
    }

    int apply(BooleanOperator operator, int f, int g) {
        assert table.isNodeValidOrLeaf(f) && table.isNodeValidOrLeaf(g);
        table.pushToWorkStack(f);
        table.pushToWorkStack(g);
        int result = applyRecursive(operator, f, g, newMemo());
        table.popWorkStack(2);
        return result;
    }

    int and(int f, int g) {
        return apply(BooleanOperator.AND, f, g);
    }

    int or(int f, int g) {
        return apply(BooleanOperator.OR, f, g);
    }

    int not(int f) {
        assert table.isNodeValidOrLeaf(f);
        table.pushToWorkStack(f);
        int result = notRecursive(f, newMemo());
        table.popWorkStack();
        return result;
    }

    int ifThenElse(int f, int g, int h) {
        assert table.isNodeValidOrLeaf(f) && table.isNodeValidOrLeaf(g) && table.isNodeValidOrLeaf(h);
        table.pushToWorkStack(f);
        table.pushToWorkStack(g);
        table.pushToWorkStack(h);
        int result = ifThenElseRecursive(f, g, h, newMemo());
        table.popWorkStack(3);
        return result;
    }

    /**
     * Fixes the variable with the given rank to {@code value}.
     */
    int restrict(int f, int rank, boolean value) {
        BitSet restricted = new BitSet();
        restricted.set(rank);
        BitSet values = new BitSet();
        values.set(rank, value);
        return restrict(f, restricted, values);
    }

    /**
     * Fixes every variable whose rank is contained in {@code restrictedRanks} to its value in {@code values}.
     */
    int restrict(int f, BitSet restrictedRanks, BitSet values) {
        assert table.isNodeValidOrLeaf(f);
        if (restrictedRanks.isEmpty()) {
            return f;
        }
        table.pushToWorkStack(f);
        int result = restrictRecursive(f, restrictedRanks, values, restrictedRanks.length() - 1, newMemo());
        table.popWorkStack();
        return result;
    }

    private int applyRecursive(BooleanOperator operator, int f, int g, OperationMemo memo) {
        if (table.isLeaf(f)) {
            boolean first = f == TRUE_NODE;
            if (table.isLeaf(g)) {
                return table.terminal(operator.apply(first, g == TRUE_NODE));
            }
            return unaryResult(operator.apply(first, false), operator.apply(first, true), g, memo);
        }
        if (table.isLeaf(g)) {
            boolean second = g == TRUE_NODE;
            return unaryResult(operator.apply(false, second), operator.apply(true, second), f, memo);
        }
        if (f == g) {
            return unaryResult(operator.apply(false, false), operator.apply(true, true), f, memo);
        }

        int first = f;
        int second = g;
        if (operator.isCommutative() && second < first) {
            first = g;
            second = f;
        }

        int cached = memo.lookup(first, second, NOT_A_NODE);
        if (cached != NOT_A_NODE) {
            return cached;
        }

        int firstVariable = table.variableOf(first);
        int secondVariable = table.variableOf(second);
        int variable = Math.min(firstVariable, secondVariable);

        int firstLow = firstVariable == variable ? table.low(first) : first;
        int firstHigh = firstVariable == variable ? table.high(first) : first;
        int secondLow = secondVariable == variable ? table.low(second) : second;
        int secondHigh = secondVariable == variable ? table.high(second) : second;

        int low = table.pushToWorkStack(applyRecursive(operator, firstLow, secondLow, memo));
        int high = table.pushToWorkStack(applyRecursive(operator, firstHigh, secondHigh, memo));
        int result = table.makeNode(variable, low, high);
        table.popWorkStack(2);
        memo.put(first, second, NOT_A_NODE, result);
        return result;
    }

    private int unaryResult(boolean onFalse, boolean onTrue, int node, OperationMemo memo) {
        if (onFalse == onTrue) {
            return table.terminal(onFalse);
        }
        return onTrue ? node : notRecursive(node, memo);
    }

    private int notRecursive(int node, OperationMemo memo) {
        if (node == TRUE_NODE) {
            return FALSE_NODE;
        }
        if (node == FALSE_NODE) {
            return TRUE_NODE;
        }

        int cached = memo.lookup(node, NOT_A_NODE, NEGATION_TAG);
        if (cached != NOT_A_NODE) {
            return cached;
        }

        int low = table.pushToWorkStack(notRecursive(table.low(node), memo));
        int high = table.pushToWorkStack(notRecursive(table.high(node), memo));
        int result = table.makeNode(table.variableOf(node), low, high);
        table.popWorkStack(2);
        memo.put(node, NOT_A_NODE, NEGATION_TAG, result);
        return result;
    }

    private int ifThenElseRecursive(int f, int g, int h, OperationMemo memo) {
        if (f == TRUE_NODE) {
            return g;
        }
        if (f == FALSE_NODE) {
            return h;
        }
        if (g == h) {
            return g;
        }
        if (g == TRUE_NODE && h == FALSE_NODE) {
            return f;
        }
        if (g == FALSE_NODE && h == TRUE_NODE) {
            return notRecursive(f, memo);
        }

        int cached = memo.lookup(f, g, h);
        if (cached != NOT_A_NODE) {
            return cached;
        }

        int fVariable = table.variableOf(f);
        int gVariable = rankOrMax(g);
        int hVariable = rankOrMax(h);
        int variable = Util.min(fVariable, gVariable, hVariable);

        int fLow = fVariable == variable ? table.low(f) : f;
        int fHigh = fVariable == variable ? table.high(f) : f;
        int gLow = gVariable == variable ? table.low(g) : g;
        int gHigh = gVariable == variable ? table.high(g) : g;
        int hLow = hVariable == variable ? table.low(h) : h;
        int hHigh = hVariable == variable ? table.high(h) : h;

        int low = table.pushToWorkStack(ifThenElseRecursive(fLow, gLow, hLow, memo));
        int high = table.pushToWorkStack(ifThenElseRecursive(fHigh, gHigh, hHigh, memo));
        int result = table.makeNode(variable, low, high);
        table.popWorkStack(2);
        memo.put(f, g, h, result);
        return result;
    }

    private int rankOrMax(int node) {
        return table.isLeaf(node) ? Integer.MAX_VALUE : table.variableOf(node);
    }

    private int restrictRecursive(int node, BitSet restrictedRanks, BitSet values, int highestRestrictedRank,
            OperationMemo memo) {
        if (table.isLeaf(node)) {
            return node;
        }
        int variable = table.variableOf(node);
        if (variable > highestRestrictedRank) {
            // Nothing below depends on the restricted variables
            return node;
        }

        int cached = memo.lookup(node, NOT_A_NODE, NOT_A_NODE);
        if (cached != NOT_A_NODE) {
            return cached;
        }

        int result;
        if (restrictedRanks.get(variable)) {
            int child = values.get(variable) ? table.high(node) : table.low(node);
            result = restrictRecursive(child, restrictedRanks, values, highestRestrictedRank, memo);
        } else {
            int low = table.pushToWorkStack(
                    restrictRecursive(table.low(node), restrictedRanks, values, highestRestrictedRank, memo));
            int high = table.pushToWorkStack(
                    restrictRecursive(table.high(node), restrictedRanks, values, highestRestrictedRank, memo));
            result = table.makeNode(variable, low, high);
            table.popWorkStack(2);
        }
        memo.put(node, NOT_A_NODE, NOT_A_NODE, result);
        return result;
    }
}
