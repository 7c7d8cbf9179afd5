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
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Checks the diagram operations against exhaustive evaluation and against alternative constructions, which have
 * to yield the identical diagram.
 */
@SuppressWarnings({"checkstyle:javadoc", "AccessingNonPublicFieldOfAnotherObject"})
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class DiagramTheoriesTest {
    private static final Logger logger = Logger.getLogger(DiagramTheoriesTest.class.getName());

    private static final int variableCount = 8;
    private static final int treeDepth = 10;
    private static final int treeWidth = 25;
    private static final int unaryCount = 300;
    private static final int binaryCount = 500;
    private static final int ternaryCount = 200;

    private static final ExpressionGenerator.Info info;
    private static final ObddManager manager;

    static {
        ObddConfiguration configuration = ImmutableObddConfiguration.builder()
                .initialSize(100)
                .logStatisticsOnShutdown(false)
                .build();
        manager = ObddManager.create(configuration);
        info = ExpressionGenerator.fill(
                manager, 0, variableCount, treeDepth, treeWidth, unaryCount, binaryCount, ternaryCount);
        logger.log(Level.INFO, "Filled manager: {0} functions, {1} unary, {2} binary and {3} ternary data points",
                new Object[] {
                    info.expressions.size(),
                    info.unaryDataPoints.size(),
                    info.binaryDataPoints.size(),
                    info.ternaryDataPoints.size()
                });
    }

    static Stream<ExpressionGenerator.UnaryDataPoint> unary() {
        return info.unaryDataPoints.stream();
    }

    static Stream<ExpressionGenerator.BinaryDataPoint> binary() {
        return info.binaryDataPoints.stream();
    }

    static Stream<ExpressionGenerator.TernaryDataPoint> ternary() {
        return info.ternaryDataPoints.stream();
    }

    private static Iterable<BitSet> valuations() {
        return Valuations.all(variableCount);
    }

    private static boolean evaluate(Expression expression, BitSet valuation) {
        return expression.evaluate(variable -> valuation.get(variable.rank()));
    }

    @AfterAll
    public void checkInvariants() {
        assertThat(manager.check(), is(true));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testEvaluateAgainstExpression(ExpressionGenerator.UnaryDataPoint dataPoint) {
        for (BitSet valuation : valuations()) {
            assertThat(dataPoint.diagram.evaluate(valuation), is(evaluate(dataPoint.expression, valuation)));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testCompileIsCanonical(ExpressionGenerator.UnaryDataPoint dataPoint) {
        assertThat(manager.compile(dataPoint.expression), sameInstance(dataPoint.diagram));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testAnd(ExpressionGenerator.BinaryDataPoint dataPoint) {
        Diagram left = dataPoint.left;
        Diagram right = dataPoint.right;
        Diagram and = left.and(right);

        for (BitSet valuation : valuations()) {
            assertThat(and.evaluate(valuation), is(left.evaluate(valuation) && right.evaluate(valuation)));
        }
        assertThat(and, sameInstance(right.and(left)));
        assertThat(and, sameInstance(left.not().or(right.not()).not()));
        assertThat(and, sameInstance(left.ifThenElse(right, manager.falseDiagram())));
        assertThat(and.and(left), sameInstance(and));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testOr(ExpressionGenerator.BinaryDataPoint dataPoint) {
        Diagram left = dataPoint.left;
        Diagram right = dataPoint.right;
        Diagram or = left.or(right);

        for (BitSet valuation : valuations()) {
            assertThat(or.evaluate(valuation), is(left.evaluate(valuation) || right.evaluate(valuation)));
        }
        assertThat(or, sameInstance(right.or(left)));
        assertThat(or, sameInstance(left.not().and(right.not()).not()));
        assertThat(or, sameInstance(left.ifThenElse(manager.trueDiagram(), right)));
        // Absorption
        assertThat(left.and(or), sameInstance(left));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testXor(ExpressionGenerator.BinaryDataPoint dataPoint) {
        Diagram left = dataPoint.left;
        Diagram right = dataPoint.right;
        Diagram xor = left.xor(right);

        for (BitSet valuation : valuations()) {
            assertThat(xor.evaluate(valuation), is(left.evaluate(valuation) ^ right.evaluate(valuation)));
        }
        assertThat(xor, sameInstance(right.xor(left)));
        assertThat(xor, sameInstance(left.equivalent(right).not()));
        assertThat(xor.xor(right), sameInstance(left));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testImplies(ExpressionGenerator.BinaryDataPoint dataPoint) {
        Diagram left = dataPoint.left;
        Diagram right = dataPoint.right;
        Diagram implies = left.implies(right);

        for (BitSet valuation : valuations()) {
            assertThat(implies.evaluate(valuation), is(!left.evaluate(valuation) || right.evaluate(valuation)));
        }
        assertThat(implies, sameInstance(left.not().or(right)));
        assertThat(implies, sameInstance(right.not().implies(left.not())));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testEquivalence(ExpressionGenerator.BinaryDataPoint dataPoint) {
        Diagram left = dataPoint.left;
        Diagram right = dataPoint.right;
        Diagram equivalence = left.equivalent(right);

        for (BitSet valuation : valuations()) {
            assertThat(equivalence.evaluate(valuation), is(left.evaluate(valuation) == right.evaluate(valuation)));
        }
        assertThat(equivalence, sameInstance(left.implies(right).and(right.implies(left))));
        assertThat(equivalence.isTrue(), is(left == right));
        assertThat(left.isEquivalent(right), is(left == right));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("binary")
    public void testCompiledOperationsMatch(ExpressionGenerator.BinaryDataPoint dataPoint) {
        for (Connective connective : List.of(
                Connective.AND, Connective.OR, Connective.XOR, Connective.IMPLIES, Connective.EQUIVALENT)) {
            Diagram compiled = manager.compile(
                    Expression.operation(connective, dataPoint.leftExpression, dataPoint.rightExpression));
            assertThat(compiled, sameInstance(dataPoint.left.apply(connective.operator(), dataPoint.right)));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testNot(ExpressionGenerator.UnaryDataPoint dataPoint) {
        Diagram diagram = dataPoint.diagram;
        Diagram not = diagram.not();

        for (BitSet valuation : valuations()) {
            assertThat(not.evaluate(valuation), is(!diagram.evaluate(valuation)));
        }
        assertThat(not.not(), sameInstance(diagram));
        assertThat(not.nodeCount(), is(diagram.nodeCount()));
        assertThat(diagram.and(not), sameInstance(manager.falseDiagram()));
        assertThat(diagram.or(not), sameInstance(manager.trueDiagram()));
        assertThat(diagram.xor(manager.trueDiagram()), sameInstance(not));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testIdentities(ExpressionGenerator.UnaryDataPoint dataPoint) {
        Diagram diagram = dataPoint.diagram;
        Diagram trueDiagram = manager.trueDiagram();
        Diagram falseDiagram = manager.falseDiagram();

        assertThat(diagram.and(diagram), sameInstance(diagram));
        assertThat(diagram.or(diagram), sameInstance(diagram));
        assertThat(diagram.xor(diagram), sameInstance(falseDiagram));
        assertThat(diagram.equivalent(diagram), sameInstance(trueDiagram));
        assertThat(diagram.implies(diagram), sameInstance(trueDiagram));
        assertThat(diagram.or(falseDiagram), sameInstance(diagram));
        assertThat(trueDiagram.and(diagram), sameInstance(diagram));
        assertThat(falseDiagram.and(diagram), sameInstance(falseDiagram));
        assertThat(trueDiagram.or(diagram), sameInstance(trueDiagram));
        assertThat(falseDiagram.implies(diagram), sameInstance(trueDiagram));
        assertThat(trueDiagram.implies(diagram), sameInstance(diagram));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("ternary")
    public void testIfThenElse(ExpressionGenerator.TernaryDataPoint dataPoint) {
        Diagram condition = dataPoint.first;
        Diagram then = dataPoint.second;
        Diagram otherwise = dataPoint.third;
        Diagram ifThenElse = condition.ifThenElse(then, otherwise);

        for (BitSet valuation : valuations()) {
            boolean expected = condition.evaluate(valuation) ? then.evaluate(valuation) : otherwise.evaluate(valuation);
            assertThat(ifThenElse.evaluate(valuation), is(expected));
        }
        assertThat(ifThenElse, sameInstance(condition.implies(then).and(condition.not().implies(otherwise))));
        assertThat(ifThenElse, sameInstance(manager.ifThenElse(condition, then, otherwise)));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testRestrict(ExpressionGenerator.UnaryDataPoint dataPoint) {
        Diagram diagram = dataPoint.diagram;
        for (Variable variable : info.variables) {
            Diagram low = diagram.restrict(variable, false);
            Diagram high = diagram.restrict(variable, true);
            assertThat(low.support(), not(hasItem(variable)));
            assertThat(high.support(), not(hasItem(variable)));

            for (BitSet valuation : valuations()) {
                BitSet copy = (BitSet) valuation.clone();
                copy.set(variable.rank(), false);
                assertThat(low.evaluate(valuation), is(diagram.evaluate(copy)));
                copy.set(variable.rank(), true);
                assertThat(high.evaluate(valuation), is(diagram.evaluate(copy)));
            }

            // Shannon expansion
            assertThat(manager.diagram(variable).ifThenElse(high, low), sameInstance(diagram));
            assertThat(low.restrict(variable, true), sameInstance(low));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testRestrictMultiple(ExpressionGenerator.UnaryDataPoint dataPoint) {
        Diagram diagram = dataPoint.diagram;
        Random random = new Random(diagram.nodeCount());

        Map<Variable, Boolean> assignment = new HashMap<>();
        for (Variable variable : info.variables) {
            if (random.nextInt(3) == 0) {
                assignment.put(variable, random.nextBoolean());
            }
        }
        Diagram restricted = diagram.restrict(assignment);

        Diagram stepwise = diagram;
        for (Map.Entry<Variable, Boolean> entry : assignment.entrySet()) {
            stepwise = stepwise.restrict(entry.getKey(), entry.getValue());
        }
        assertThat(restricted, sameInstance(stepwise));

        for (BitSet valuation : valuations()) {
            BitSet copy = (BitSet) valuation.clone();
            assignment.forEach((variable, value) -> copy.set(variable.rank(), value));
            assertThat(restricted.evaluate(valuation), is(diagram.evaluate(copy)));
        }
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testSupport(ExpressionGenerator.UnaryDataPoint dataPoint) {
        Diagram diagram = dataPoint.diagram;
        List<Variable> support = diagram.support();

        Set<Variable> expected = new HashSet<>();
        for (Variable variable : info.variables) {
            if (diagram.restrict(variable, false) != diagram.restrict(variable, true)) {
                expected.add(variable);
            }
        }
        assertThat(ImmutableSet.copyOf(support), is(expected));
        for (int i = 1; i < support.size(); i++) {
            assertThat(support.get(i - 1).rank() < support.get(i).rank(), is(true));
        }
        assertThat(dataPoint.expression.variables().containsAll(support), is(true));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testLowAndHigh(ExpressionGenerator.UnaryDataPoint dataPoint) {
        Diagram diagram = dataPoint.diagram;
        if (diagram.isTerminal()) {
            assertThat(diagram.terminalValue(), is(diagram.isTrue()));
            return;
        }
        Variable variable = diagram.topVariable();
        assertThat(diagram.low(), sameInstance(diagram.restrict(variable, false)));
        assertThat(diagram.high(), sameInstance(diagram.restrict(variable, true)));
        assertThat(diagram.low(), not(sameInstance(diagram.high())));
        assertThat(manager.diagram(variable).ifThenElse(diagram.high(), diagram.low()), sameInstance(diagram));
    }

    @ParameterizedTest(name = "{index}")
    @MethodSource("unary")
    public void testTraversal(ExpressionGenerator.UnaryDataPoint dataPoint) {
        Diagram diagram = dataPoint.diagram;
        List<Diagram> postorder = diagram.nodes();
        List<Diagram> preorder = diagram.preorder();

        int expectedSize = diagram.isTerminal() ? 1 : diagram.nodeCount() + 2;
        assertThat(postorder.size(), is(expectedSize));
        assertThat(ImmutableSet.copyOf(postorder).size(), is(expectedSize));
        assertThat(ImmutableSet.copyOf(preorder), is(ImmutableSet.copyOf(postorder)));
        assertThat(postorder.get(postorder.size() - 1), sameInstance(diagram));
        assertThat(preorder.get(0), sameInstance(diagram));

        List<Diagram> seen = new ArrayList<>();
        for (Diagram node : postorder) {
            if (!node.isTerminal()) {
                // Children come first, ordering holds along every edge
                assertThat(seen, hasItem(node.low()));
                assertThat(seen, hasItem(node.high()));
                for (Diagram child : List.of(node.low(), node.high())) {
                    if (!child.isTerminal()) {
                        assertThat(node.topVariable().rank() < child.topVariable().rank(), is(true));
                    }
                }
            }
            seen.add(node);
        }

        List<Diagram> decisionNodes = new ArrayList<>(postorder);
        decisionNodes.removeIf(Diagram::isTerminal);
        assertThat(decisionNodes.size(), is(diagram.nodeCount()));
        if (diagram.isTerminal()) {
            assertThat(decisionNodes, is(empty()));
        }
    }
}
