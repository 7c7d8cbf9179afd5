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
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A Boolean function, represented by the root of a reduced ordered binary decision diagram.
 *
 * <p>Diagrams are immutable and canonical within their {@link ObddManager}: two diagrams of the same manager
 * represent the same function if and only if they are the same object. Hence, {@code equals} is identity. All
 * operations taking another diagram reject diagrams of other managers with an
 * {@link IllegalArgumentException}.</p>
 */
public interface Diagram {
    ObddManager manager();

    /**
     * Returns an identifier of the root node, stable for as long as this object is reachable. Exporters may use it
     * to name nodes.
     */
    int id();

    boolean isTerminal();

    boolean isTrue();

    boolean isFalse();

    /**
     * Returns the value of a terminal.
     *
     * @throws IllegalStateException
     *     if this is a decision node.
     */
    boolean terminalValue();

    /**
     * Returns the variable tested at the root.
     *
     * @throws IllegalStateException
     *     if this is a terminal.
     */
    Variable topVariable();

    /**
     * Synonym of {@link #topVariable()}, used by exporters walking the graph.
     */
    default Variable variable() {
        return topVariable();
    }

    /**
     * Returns the diagram reached if the {@link #topVariable() top variable} is false.
     *
     * @throws IllegalStateException
     *     if this is a terminal.
     */
    Diagram low();

    /**
     * Returns the diagram reached if the {@link #topVariable() top variable} is true.
     *
     * @throws IllegalStateException
     *     if this is a terminal.
     */
    Diagram high();

    Diagram apply(BooleanOperator operator, Diagram other);

    Diagram not();

    default Diagram and(Diagram other) {
        return apply(BooleanOperator.AND, other);
    }

    default Diagram or(Diagram other) {
        return apply(BooleanOperator.OR, other);
    }

    default Diagram xor(Diagram other) {
        return apply(BooleanOperator.XOR, other);
    }

    default Diagram implies(Diagram other) {
        return apply(BooleanOperator.IMPLIES, other);
    }

    default Diagram equivalent(Diagram other) {
        return apply(BooleanOperator.EQUIVALENCE, other);
    }

    /**
     * Returns the function which equals {@code then} wherever this function is true and {@code otherwise}
     * elsewhere.
     */
    Diagram ifThenElse(Diagram then, Diagram otherwise);

    /**
     * Fixes the given variable to {@code value}. The result does not depend on the variable anymore.
     */
    Diagram restrict(Variable variable, boolean value);

    /**
     * Fixes each of the given variables to its assigned value.
     */
    Diagram restrict(Map<Variable, Boolean> assignment);

    /**
     * Evaluates the function under the assignment in which exactly the given variables are true.
     */
    boolean evaluate(Set<Variable> trueVariables);

    /**
     * Evaluates the function under the assignment in which exactly the variables with the given ranks are true.
     */
    boolean evaluate(BitSet trueRanks);

    /**
     * Returns the variables this function depends on, ordered by rank.
     */
    List<Variable> support();

    /**
     * Returns the number of decision nodes of this diagram, excluding the terminals.
     */
    int nodeCount();

    /**
     * Returns all nodes of this diagram including the terminals, each exactly once, children before their parents.
     */
    List<Diagram> nodes();

    /**
     * Returns all nodes of this diagram including the terminals, each exactly once, parents before their children.
     */
    List<Diagram> preorder();

    /**
     * Tells whether both diagrams represent the same function, which is the case iff they are the same object.
     */
    boolean isEquivalent(Diagram other);
}
