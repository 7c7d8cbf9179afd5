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

import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns a variable order, the node table and all {@link Diagram diagrams} built on top of it. Diagrams of
 * different managers must not be mixed.
 *
 * <p>Implementations are thread safe.</p>
 */
public interface ObddManager {
    static ObddManager create() {
        return create(ImmutableObddConfiguration.builder().build());
    }

    static ObddManager create(ObddConfiguration configuration) {
        return new ObddManagerImpl(configuration);
    }

    /**
     * Returns the variable identified by the given names and indices, registering it as the last variable of the
     * order if it is not known yet.
     *
     * @throws IllegalArgumentException
     *     if {@code names} is empty or contains {@code null}, or if {@code indices} contains {@code null} or a
     *     negative value.
     */
    Variable variable(List<String> names, List<Integer> indices);

    default Variable variable(String name) {
        return variable(Collections.singletonList(name), List.of());
    }

    default Variable variable(String name, int... indices) {
        return variable(Collections.singletonList(name), Ints.asList(indices));
    }

    /**
     * Registers one scalar variable for each name, in the given order.
     */
    default List<Variable> variables(String... names) {
        List<Variable> variables = new ArrayList<>(names.length);
        for (String name : names) {
            variables.add(variable(name));
        }
        return variables;
    }

    int variableCount();

    Variable variableOfRank(int rank);

    /**
     * Returns all registered variables ordered by rank.
     */
    List<Variable> registeredVariables();

    boolean isRegistered(Variable variable);

    /**
     * Compares the position of the two variables in the order. Smaller variables are tested closer to the root.
     */
    int compare(Variable first, Variable second);

    Diagram falseDiagram();

    Diagram trueDiagram();

    default Diagram constant(boolean value) {
        return value ? trueDiagram() : falseDiagram();
    }

    /**
     * Returns the function which is true iff the given variable is.
     */
    Diagram diagram(Variable variable);

    /**
     * Returns the function which is true iff the given variable is false.
     */
    Diagram negatedDiagram(Variable variable);

    /**
     * Builds the diagram of the given expression.
     *
     * @throws MalformedExpressionException
     *     if some operation of the expression has the wrong number of operands.
     */
    Diagram compile(Expression expression);

    Diagram ifThenElse(Diagram condition, Diagram then, Diagram otherwise);

    default Diagram and(Diagram... diagrams) {
        Diagram result = trueDiagram();
        for (Diagram diagram : diagrams) {
            result = result.and(diagram);
        }
        return result;
    }

    default Diagram or(Diagram... diagrams) {
        Diagram result = falseDiagram();
        for (Diagram diagram : diagrams) {
            result = result.or(diagram);
        }
        return result;
    }

    /**
     * Counts the decision nodes reachable from any live diagram.
     */
    int activeNodeCount();

    /**
     * Releases the nodes of all collected diagrams and reclaims every node not reachable from a live diagram.
     *
     * @return The number of reclaimed nodes.
     */
    int forceGc();

    /**
     * Runs an integrity check of the node table.
     *
     * @throws IllegalStateException
     *     if some invariant is violated.
     */
    boolean check();

    String statistics();
}
