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

import static de.tum.in.jobdd.Util.checkArgument;
import static de.tum.in.jobdd.Util.checkState;

import com.google.common.collect.ImmutableList;
import java.util.BitSet;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Default manager. Every operation runs under a read-write lock: anything which may create nodes, register
 * variables or hand out diagrams takes the write lock, pure reads take the read lock.
 */
final class ObddManagerImpl implements ObddManager {
    private static final Logger logger = Logger.getLogger(ObddManagerImpl.class.getName());
    private static final Collection<ObddManagerImpl> statisticsShutdownHook = new ConcurrentLinkedDeque<>();

    private final ObddConfiguration configuration;
    private final NodeTable table;
    private final DiagramHandles handles;
    private final VariableRegistry registry;
    private final ApplyEngine engine;
    private final ExpressionCompiler compiler;

    private final Lock readLock;
    private final Lock writeLock;

    private final DiagramImpl falseDiagram;
    private final DiagramImpl trueDiagram;

    ObddManagerImpl(ObddConfiguration configuration) {
        this.configuration = configuration;
        this.table = new NodeTable(
                configuration.initialSize(),
                configuration.useGarbageCollection() ? configuration.minimumFreeNodePercentageAfterGc() : 1.0,
                configuration.growthFactor());
        this.handles = new DiagramHandles(table, node -> new DiagramImpl(this, node));
        this.registry = new VariableRegistry(NodeTable.MAXIMAL_VARIABLE_COUNT);
        this.engine = new ApplyEngine(table, configuration.memoInitialSize());
        this.compiler = new ExpressionCompiler(table, engine, registry);

        ReadWriteLock lock = new ReentrantReadWriteLock();
        this.readLock = lock.readLock();
        this.writeLock = lock.writeLock();

        this.falseDiagram = make(table.falseNode());
        this.trueDiagram = make(table.trueNode());

        if (logger.isLoggable(Level.INFO) && configuration.logStatisticsOnShutdown()) {
            logger.log(Level.FINER, "Adding {0} to shutdown hook", this);
            ShutdownHookLazyHolder.init();
            statisticsShutdownHook.add(this);
        }
        logger.log(Level.FINE, "Created manager with {0}", configuration);
    }

    private DiagramImpl make(int node) {
        return handles.of(node);
    }

    private int node(Diagram diagram) {
        checkArgument(diagram instanceof DiagramImpl && ((DiagramImpl) diagram).manager == this,
                "Diagram %s belongs to a different manager", diagram);
        int node = ((DiagramImpl) diagram).node;
        assert table.referenceCount(node) > 0 || table.referenceCount(node) == -1;
        return node;
    }

    private int rank(Variable variable) {
        checkArgument(registry.contains(variable), "Variable %s is not registered with this manager", variable);
        return variable.rank();
    }

    // Variables

    @Override
    public Variable variable(List<String> names, List<Integer> indices) {
        writeLock.lock();
        try {
            int previousCount = registry.size();
            Variable variable = registry.register(names, indices);
            if (registry.size() > previousCount) {
                // Variable diagrams are permanent
                int rank = variable.rank();
                table.saturateNode(table.makeNode(rank, table.falseNode(), table.trueNode()));
                table.saturateNode(table.makeNode(rank, table.trueNode(), table.falseNode()));
            }
            return variable;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int variableCount() {
        readLock.lock();
        try {
            return registry.size();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Variable variableOfRank(int rank) {
        readLock.lock();
        try {
            checkArgument(0 <= rank && rank < registry.size(), "No variable with rank %d", rank);
            return registry.variableOfRank(rank);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public List<Variable> registeredVariables() {
        readLock.lock();
        try {
            return registry.variables();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public boolean isRegistered(Variable variable) {
        readLock.lock();
        try {
            return registry.contains(variable);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public int compare(Variable first, Variable second) {
        readLock.lock();
        try {
            return Integer.compare(rank(first), rank(second));
        } finally {
            readLock.unlock();
        }
    }

    // Diagrams

    @Override
    public Diagram falseDiagram() {
        return falseDiagram;
    }

    @Override
    public Diagram trueDiagram() {
        return trueDiagram;
    }

    @Override
    public Diagram diagram(Variable variable) {
        writeLock.lock();
        try {
            return make(compiler.variableNode(rank(variable)));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Diagram negatedDiagram(Variable variable) {
        writeLock.lock();
        try {
            return make(table.makeNode(rank(variable), table.trueNode(), table.falseNode()));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Diagram compile(Expression expression) {
        writeLock.lock();
        try {
            return make(compiler.compile(expression));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Diagram ifThenElse(Diagram condition, Diagram then, Diagram otherwise) {
        writeLock.lock();
        try {
            return make(engine.ifThenElse(node(condition), node(then), node(otherwise)));
        } finally {
            writeLock.unlock();
        }
    }

    // Memory and statistics

    @Override
    public int activeNodeCount() {
        writeLock.lock();
        try {
            handles.releaseCollected();
            return table.activeNodeCount();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int forceGc() {
        writeLock.lock();
        try {
            int released = handles.releaseCollected();
            int collected = table.forceGc();
            logger.log(Level.FINE, "Released {0} diagrams, collected {1} nodes", new Object[] {released, collected});
            return collected;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean check() {
        writeLock.lock();
        try {
            return table.check();
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public String statistics() {
        readLock.lock();
        try {
            return String.format("%s%nVariables: %d, tracked diagrams: %d, permanent diagrams: %d",
                    table.getStatistics(), registry.size(), handles.trackedCount(), handles.permanentCount());
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public String toString() {
        return String.format("ObddManager{%d variables, table size %d}", registry.size(), table.tableSize());
    }

    static final class DiagramImpl implements Diagram {
        private final ObddManagerImpl manager;
        private final int node;

        @Nullable
        private List<Variable> supportCache;

        DiagramImpl(ObddManagerImpl manager, int node) {
            this.manager = manager;
            this.node = node;
        }

        private DiagramImpl make(int node) {
            return node == this.node ? this : manager.make(node);
        }

        int node() {
            return node;
        }

        @Override
        public ObddManager manager() {
            return manager;
        }

        @Override
        public int id() {
            return node;
        }

        @Override
        public boolean isTerminal() {
            return node < 0;
        }

        @Override
        public boolean isTrue() {
            return node == NodeTable.TRUE_NODE;
        }

        @Override
        public boolean isFalse() {
            return node == NodeTable.FALSE_NODE;
        }

        @Override
        public boolean terminalValue() {
            checkState(isTerminal(), "Decision node %s has no terminal value", this);
            return isTrue();
        }

        @Override
        public Variable topVariable() {
            checkState(!isTerminal(), "Terminal %s tests no variable", this);
            manager.readLock.lock();
            try {
                return manager.registry.variableOfRank(manager.table.variableOf(node));
            } finally {
                manager.readLock.unlock();
            }
        }

        @Override
        public Diagram low() {
            checkState(!isTerminal(), "Terminal %s has no children", this);
            manager.writeLock.lock();
            try {
                return make(manager.table.low(node));
            } finally {
                manager.writeLock.unlock();
            }
        }

        @Override
        public Diagram high() {
            checkState(!isTerminal(), "Terminal %s has no children", this);
            manager.writeLock.lock();
            try {
                return make(manager.table.high(node));
            } finally {
                manager.writeLock.unlock();
            }
        }

        @Override
        public Diagram apply(BooleanOperator operator, Diagram other) {
            manager.writeLock.lock();
            try {
                return make(manager.engine.apply(operator, node, manager.node(other)));
            } finally {
                manager.writeLock.unlock();
            }
        }

        @Override
        public Diagram not() {
            manager.writeLock.lock();
            try {
                return make(manager.engine.not(node));
            } finally {
                manager.writeLock.unlock();
            }
        }

        @Override
        public Diagram ifThenElse(Diagram then, Diagram otherwise) {
            return manager.ifThenElse(this, then, otherwise);
        }

        @Override
        public Diagram restrict(Variable variable, boolean value) {
            manager.writeLock.lock();
            try {
                return make(manager.engine.restrict(node, manager.rank(variable), value));
            } finally {
                manager.writeLock.unlock();
            }
        }

        @Override
        public Diagram restrict(Map<Variable, Boolean> assignment) {
            manager.writeLock.lock();
            try {
                BitSet restrictedRanks = new BitSet();
                BitSet values = new BitSet();
                for (Map.Entry<Variable, Boolean> entry : assignment.entrySet()) {
                    int rank = manager.rank(entry.getKey());
                    checkArgument(entry.getValue() != null, "No value given for %s", entry.getKey());
                    restrictedRanks.set(rank);
                    values.set(rank, entry.getValue());
                }
                return make(manager.engine.restrict(node, restrictedRanks, values));
            } finally {
                manager.writeLock.unlock();
            }
        }

        @Override
        public boolean evaluate(Set<Variable> trueVariables) {
            manager.readLock.lock();
            try {
                BitSet trueRanks = new BitSet();
                for (Variable variable : trueVariables) {
                    trueRanks.set(manager.rank(variable));
                }
                return manager.table.evaluate(node, trueRanks);
            } finally {
                manager.readLock.unlock();
            }
        }

        @Override
        public boolean evaluate(BitSet trueRanks) {
            manager.readLock.lock();
            try {
                return manager.table.evaluate(node, trueRanks);
            } finally {
                manager.readLock.unlock();
            }
        }

        @Override
        public List<Variable> support() {
            // Diagrams are immutable, so the support never changes
            List<Variable> support = supportCache;
            if (support != null) {
                return support;
            }
            manager.writeLock.lock();
            try {
                BitSet ranks = manager.table.support(node);
                ImmutableList.Builder<Variable> builder = ImmutableList.builderWithExpectedSize(ranks.cardinality());
                for (int rank = ranks.nextSetBit(0); rank >= 0; rank = ranks.nextSetBit(rank + 1)) {
                    builder.add(manager.registry.variableOfRank(rank));
                }
                support = builder.build();
            } finally {
                manager.writeLock.unlock();
            }
            supportCache = support;
            return support;
        }

        @Override
        public int nodeCount() {
            manager.writeLock.lock();
            try {
                return manager.table.nodeCount(node);
            } finally {
                manager.writeLock.unlock();
            }
        }

        @Override
        public List<Diagram> nodes() {
            manager.writeLock.lock();
            try {
                return wrap(manager.table.postorder(node));
            } finally {
                manager.writeLock.unlock();
            }
        }

        @Override
        public List<Diagram> preorder() {
            manager.writeLock.lock();
            try {
                return wrap(manager.table.preorder(node));
            } finally {
                manager.writeLock.unlock();
            }
        }

        private List<Diagram> wrap(int[] nodes) {
            ImmutableList.Builder<Diagram> builder = ImmutableList.builderWithExpectedSize(nodes.length);
            for (int node : nodes) {
                builder.add(make(node));
            }
            return builder.build();
        }

        @Override
        public boolean isEquivalent(Diagram other) {
            manager.readLock.lock();
            try {
                return node == manager.node(other);
            } finally {
                manager.readLock.unlock();
            }
        }

        @Override
        public boolean equals(Object obj) {
            return this == obj;
        }

        @Override
        public int hashCode() {
            return HashUtil.hash(node);
        }

        @Override
        public String toString() {
            if (isTerminal()) {
                return String.valueOf(isTrue());
            }
            return String.format("%d@[%s]", node, topVariable());
        }
    }

    private static final class ShutdownHookLazyHolder {
        private static final Runnable shutdownHook = new ShutdownHookPrinter();

        static {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook));
        }

        static void init() {
            // bogus method to force static initialization
        }
    }

    private static final class ShutdownHookPrinter implements Runnable {
        @Override
        public void run() {
            if (!logger.isLoggable(Level.INFO)) {
                return;
            }
            for (ObddManagerImpl manager : statisticsShutdownHook) {
                logger.info(manager.statistics());
            }
        }
    }
}
