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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Randomly builds diagrams through the diagram operations and records, for each of them, an expression describing
 * the same function. Generation only depends on the seed.
 */
@SuppressWarnings("PMD.AvoidInstantiatingObjectsInLoops")
final class ExpressionGenerator {
    private static final int MAX_FAILED_UPDATE = 10;
    private static final Logger logger = Logger.getLogger(ExpressionGenerator.class.getName());
    private static final List<Connective> BINARY_CONNECTIVES = List.of(
            Connective.AND, Connective.OR, Connective.XOR, Connective.IMPLIES, Connective.EQUIVALENT);

    private ExpressionGenerator() {
        // empty
    }

    static Info fill(ObddManager manager, int seed, int variableCount, int treeDepth, int treeWidth,
            int unaryCount, int binaryCount, int ternaryCount) {
        logger.log(Level.FINE, "Filling manager: {0}/{1}, {2} unary, {3} binary, {4} ternary",
                new Object[] {treeDepth, treeWidth, unaryCount, binaryCount, ternaryCount});

        Random filter = new Random(seed);
        List<Variable> variables = new ArrayList<>(variableCount);
        for (int i = 0; i < variableCount; i++) {
            variables.add(manager.variable("x", i));
        }

        // Diagrams are canonical, hence each function is recorded once
        Map<Diagram, Expression> expressions = new LinkedHashMap<>();
        expressions.put(manager.falseDiagram(), Expression.FALSE);
        expressions.put(manager.trueDiagram(), Expression.TRUE);
        for (Variable variable : variables) {
            Expression literal = Expression.variable(variable);
            expressions.put(manager.diagram(variable), literal);
            expressions.put(manager.negatedDiagram(variable), Expression.not(literal));
        }

        Set<Diagram> previousDepth = new LinkedHashSet<>(expressions.keySet());
        List<Diagram> candidates = new ArrayList<>();
        for (int depth = 1; depth < treeDepth; depth++) {
            candidates.addAll(previousDepth);
            previousDepth.clear();
            Collections.shuffle(candidates, filter);
            List<Diagram> leftCandidates = ImmutableList.copyOf(candidates);
            Collections.shuffle(candidates, filter);
            List<Diagram> rightCandidates = ImmutableList.copyOf(candidates);
            candidates.clear();

            for (Diagram left : leftCandidates) {
                for (Diagram right : rightCandidates) {
                    Expression leftExpression = expressions.get(left);
                    Expression rightExpression = expressions.get(right);
                    for (Connective connective : BINARY_CONNECTIVES) {
                        if (filter.nextBoolean()) {
                            Diagram created = left.apply(Objects.requireNonNull(connective.operator()), right);
                            record(expressions, previousDepth, created,
                                    Expression.operation(connective, leftExpression, rightExpression));
                        }
                    }
                    if (filter.nextBoolean()) {
                        record(expressions, previousDepth, left.not(), Expression.not(leftExpression));
                    }
                    if (expressions.size() >= treeWidth * depth) {
                        break;
                    }
                }
                if (expressions.size() >= treeWidth * depth) {
                    break;
                }
            }

            int failedUpdates = 0;
            Iterator<Diagram> cycle = Iterators.cycle(expressions.keySet());
            while (previousDepth.size() < treeWidth && failedUpdates < MAX_FAILED_UPDATE) {
                Diagram next = cycle.next();
                if (filter.nextBoolean()) {
                    continue;
                }
                if (previousDepth.add(next)) {
                    failedUpdates = 0;
                } else {
                    failedUpdates += 1;
                }
            }
        }

        List<Diagram> available = new ArrayList<>(expressions.keySet());

        int unaryFailedUpdates = 0;
        Collection<UnaryDataPoint> unary = new LinkedHashSet<>();
        while (unary.size() < unaryCount && unaryFailedUpdates < MAX_FAILED_UPDATE) {
            Diagram diagram = available.get(filter.nextInt(available.size()));
            if (unary.add(new UnaryDataPoint(diagram, expressions.get(diagram)))) {
                unaryFailedUpdates = 0;
            } else {
                unaryFailedUpdates += 1;
            }
        }

        int binaryFailedUpdates = 0;
        Collection<BinaryDataPoint> binary = new LinkedHashSet<>();
        while (binary.size() < binaryCount && binaryFailedUpdates < MAX_FAILED_UPDATE) {
            Diagram left = available.get(filter.nextInt(available.size()));
            Diagram right = available.get(filter.nextInt(available.size()));
            if (binary.add(new BinaryDataPoint(left, right, expressions.get(left), expressions.get(right)))) {
                binaryFailedUpdates = 0;
            } else {
                binaryFailedUpdates += 1;
            }
        }

        int ternaryFailedUpdates = 0;
        Collection<TernaryDataPoint> ternary = new LinkedHashSet<>();
        while (ternary.size() < ternaryCount && ternaryFailedUpdates < MAX_FAILED_UPDATE) {
            Diagram first = available.get(filter.nextInt(available.size()));
            Diagram second = available.get(filter.nextInt(available.size()));
            Diagram third = available.get(filter.nextInt(available.size()));
            if (ternary.add(new TernaryDataPoint(first, second, third))) {
                ternaryFailedUpdates = 0;
            } else {
                ternaryFailedUpdates += 1;
            }
        }

        logger.log(Level.FINE, "Filled manager with {0} functions", expressions.size());
        return new Info(manager, variables, expressions, unary, binary, ternary);
    }

    private static void record(Map<Diagram, Expression> expressions, Set<Diagram> depth, Diagram diagram,
            Expression expression) {
        if (expressions.putIfAbsent(diagram, expression) == null) {
            depth.add(diagram);
        }
    }

    static final class Info {
        final ObddManager manager;
        final List<Variable> variables;
        final Map<Diagram, Expression> expressions;
        final ImmutableSet<UnaryDataPoint> unaryDataPoints;
        final ImmutableSet<BinaryDataPoint> binaryDataPoints;
        final ImmutableSet<TernaryDataPoint> ternaryDataPoints;

        Info(ObddManager manager, List<Variable> variables, Map<Diagram, Expression> expressions,
                Collection<UnaryDataPoint> unary, Collection<BinaryDataPoint> binary,
                Collection<TernaryDataPoint> ternary) {
            this.manager = manager;
            this.variables = ImmutableList.copyOf(variables);
            this.expressions = expressions;
            this.unaryDataPoints = ImmutableSet.copyOf(unary);
            this.binaryDataPoints = ImmutableSet.copyOf(binary);
            this.ternaryDataPoints = ImmutableSet.copyOf(ternary);
        }
    }

    static final class UnaryDataPoint {
        final Diagram diagram;
        final Expression expression;

        UnaryDataPoint(Diagram diagram, Expression expression) {
            this.diagram = diagram;
            this.expression = expression;
        }

        @Override
        public boolean equals(Object o) {
            return this == o || (o instanceof UnaryDataPoint && diagram == ((UnaryDataPoint) o).diagram);
        }

        @Override
        public int hashCode() {
            return diagram.hashCode();
        }

        @Override
        public String toString() {
            return expression.toString();
        }
    }

    static final class BinaryDataPoint {
        final Diagram left;
        final Diagram right;
        final Expression leftExpression;
        final Expression rightExpression;

        BinaryDataPoint(Diagram left, Diagram right, Expression leftExpression, Expression rightExpression) {
            this.left = left;
            this.right = right;
            this.leftExpression = leftExpression;
            this.rightExpression = rightExpression;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof BinaryDataPoint)) {
                return false;
            }
            BinaryDataPoint other = (BinaryDataPoint) o;
            return left == other.left && right == other.right;
        }

        @Override
        public int hashCode() {
            return HashUtil.hash(left.hashCode(), right.hashCode());
        }

        @Override
        public String toString() {
            return String.format("(%s, %s)", leftExpression, rightExpression);
        }
    }

    static final class TernaryDataPoint {
        final Diagram first;
        final Diagram second;
        final Diagram third;

        TernaryDataPoint(Diagram first, Diagram second, Diagram third) {
            this.first = first;
            this.second = second;
            this.third = third;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof TernaryDataPoint)) {
                return false;
            }
            TernaryDataPoint other = (TernaryDataPoint) o;
            return first == other.first && second == other.second && third == other.third;
        }

        @Override
        public int hashCode() {
            return HashUtil.mixedHash(first.hashCode(), second.hashCode(), third.hashCode());
        }
    }
}
