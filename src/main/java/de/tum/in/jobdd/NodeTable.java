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

import java.util.Arrays;
import java.util.BitSet;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;

/**
 * The unique table of all decision nodes of one manager. Nodes are identified by their index in the table, the
 * two terminals by the negative constants {@link #TRUE_NODE} and {@link #FALSE_NODE}.
 *
 * <p>The table guarantees that at most one valid node exists for each (variable, low, high) triple. Nodes are
 * owned through reference counts and the work stack. The hash chains do not keep nodes alive: whenever the table
 * runs out of space, nodes which are neither referenced, saturated, on the work stack nor reachable from any of
 * those are reclaimed and their slots re-used. Every such collection increments
 * {@link #garbageCollectionCount()}, which allows per-operation memo tables to detect stale entries.</p>
 *
 * <p>Note that for the sake of performance, most required properties of the arguments are only checked through
 * {@code assert} statements.</p>
 */
@SuppressWarnings({"PMD.TooManyFields", "PMD.GodClass"})
final class NodeTable {
    private static final Logger logger = Logger.getLogger(NodeTable.class.getName());

    static final int TRUE_NODE = -1;
    static final int FALSE_NODE = -2;

    // Use 0 as "not a node" to make re-allocations slightly more efficient
    static final int NOT_A_NODE = 0;
    static final int FIRST_NODE = 1;

    /* Bits allocated for the reference counter */
    private static final int REFERENCE_COUNT_BIT_SIZE = 14;
    private static final int REFERENCE_COUNT_SATURATED = (1 << REFERENCE_COUNT_BIT_SIZE) - 1;
    private static final int REFERENCE_COUNT_MASK = (1 << REFERENCE_COUNT_BIT_SIZE) - 1;
    private static final int REFERENCE_COUNT_OFFSET = 1;
    /* Bits allocated for the variable rank */
    private static final int VARIABLE_BIT_SIZE = 17;

    /* Variable value used to indicate invalid nodes */
    private static final int INVALID_NODE_VARIABLE = (1 << VARIABLE_BIT_SIZE) - 1;
    private static final int VARIABLE_OFFSET = REFERENCE_COUNT_OFFSET + REFERENCE_COUNT_BIT_SIZE;

    /** Ranks {@code 0} to {@code MAXIMAL_VARIABLE_COUNT - 1} fit into the node layout. */
    static final int MAXIMAL_VARIABLE_COUNT = INVALID_NODE_VARIABLE;

    static {
        //noinspection ConstantValue
        assert VARIABLE_BIT_SIZE + REFERENCE_COUNT_BIT_SIZE + 1 == Integer.SIZE;
    }

    private static final int MINIMUM_NODE_TABLE_SIZE = Primes.nextPrime(1_000);
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    static int dataMake(int variable) {
        return variable << VARIABLE_OFFSET;
    }

    static int dataGetVariable(int metadata) {
        assert dataIsValid(metadata);
        return metadata >>> VARIABLE_OFFSET;
    }

    static boolean dataIsValid(int metadata) {
        return (metadata >>> VARIABLE_OFFSET) != INVALID_NODE_VARIABLE;
    }

    static int dataMakeInvalid() {
        return INVALID_NODE_VARIABLE << VARIABLE_OFFSET;
    }

    static boolean dataIsSaturated(int metadata) {
        return dataGetReferenceCountUnsafe(metadata) == REFERENCE_COUNT_SATURATED;
    }

    static int dataSaturate(int metadata) {
        return metadata | (REFERENCE_COUNT_SATURATED << REFERENCE_COUNT_OFFSET);
    }

    static boolean dataIsReferencedOrSaturated(int metadata) {
        return dataGetReferenceCountUnsafe(metadata) > 0;
    }

    static int dataGetReferenceCountUnsafe(int metadata) {
        return (metadata >>> REFERENCE_COUNT_OFFSET) & REFERENCE_COUNT_MASK;
    }

    static int dataIncreaseReferenceCount(int metadata) {
        assert !dataIsSaturated(metadata);
        return metadata + (1 << REFERENCE_COUNT_OFFSET);
    }

    static int dataDecreaseReferenceCount(int metadata) {
        assert !dataIsSaturated(metadata) && dataGetReferenceCountUnsafe(metadata) > 0;
        return metadata - (1 << REFERENCE_COUNT_OFFSET);
    }

    static int dataSetMark(int metadata) {
        return metadata | 1;
    }

    static int dataClearMark(int metadata) {
        return metadata & ~1;
    }

    static boolean dataIsMarked(int metadata) {
        return (metadata & 1) != 0;
    }

    private final double minimumFreeNodeAfterGc;
    private final double growthFactor;

    /* Approximation of dead node count. */
    private int approximateDeadNodeCount = 0;
    /* If a node has positive reference count, its index is less than or equal to biggestReferencedNode. */
    private int biggestReferencedNode;
    /* If a node is valid, its index is less than or equal to biggestValidNode. */
    private int biggestValidNode;
    /* First free (invalid) node, used when a new node is created. */
    private int firstFreeNode;
    private int freeNodeCount;

    /* Nodes on the work stack survive garbage collection. Operations push their arguments and intermediate
     * results here instead of changing reference counts. */
    private int[] workStack;
    private int workStackIndex = 0;

    /* Layout: <---VAR---><---REF---><MASK> */
    private int[] nodes;
    /* Low and high successors of each node */
    private int[] tree;

    /* Hash buckets and chains for valid nodes. For invalid nodes, the chain entry points to the next free node
     * instead, which saves a scan for free slots when creating nodes. */
    private int[] hashToChainStart;
    private int[] hashChain;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;
    private long garbageCollectionCount = 0;
    private long garbageCollectedNodeCount = 0;
    private long garbageCollectionTime = 0;

    NodeTable(int initialSize, double minimumFreeNodeAfterGc, double growthFactor) {
        this.minimumFreeNodeAfterGc = minimumFreeNodeAfterGc;
        this.growthFactor = growthFactor;
        int tableSize = Math.max(Primes.nextPrime(initialSize), MINIMUM_NODE_TABLE_SIZE);

        nodes = new int[tableSize];
        tree = new int[2 * tableSize];
        hashToChainStart = new int[tableSize];
        hashChain = new int[tableSize];

        firstFreeNode = FIRST_NODE;
        freeNodeCount = tableSize - FIRST_NODE;
        biggestReferencedNode = NOT_A_NODE;
        biggestValidNode = NOT_A_NODE;

        Arrays.fill(nodes, dataMakeInvalid());
        // Just to ensure a fail-fast
        Arrays.fill(hashChain, 0, FIRST_NODE, Integer.MIN_VALUE);
        for (int i = FIRST_NODE; i < tableSize - 1; i++) {
            hashChain[i] = i + 1;
        }
        hashChain[tableSize - 1] = FIRST_NODE;

        workStack = new int[32];
    }

    // Terminals and structure

    int trueNode() {
        return TRUE_NODE;
    }

    int falseNode() {
        return FALSE_NODE;
    }

    int terminal(boolean value) {
        return value ? TRUE_NODE : FALSE_NODE;
    }

    boolean isLeaf(int node) {
        assert FALSE_NODE <= node && node < tableSize();
        return node < 0;
    }

    boolean isNodeValid(int node) {
        assert FALSE_NODE <= node && node < tableSize();
        return FIRST_NODE <= node && node <= biggestValidNode && dataIsValid(nodes[node]);
    }

    boolean isNodeValidOrLeaf(int node) {
        return isLeaf(node) || isNodeValid(node);
    }

    /**
     * Returns the rank of the variable tested by {@code node} or {@code -1} for a leaf.
     */
    int variableOf(int node) {
        assert isNodeValidOrLeaf(node);
        return isLeaf(node) ? -1 : dataGetVariable(nodes[node]);
    }

    int low(int node) {
        assert isNodeValid(node);
        return tree[2 * node];
    }

    int high(int node) {
        assert isNodeValid(node);
        return tree[2 * node + 1];
    }

    /**
     * Returns the unique node testing {@code variable} with the given children. If both children coincide, the
     * test is redundant and {@code low} is returned. The variable must precede the variables of both children.
     */
    int makeNode(int variable, int low, int high) {
        assert 0 <= variable && variable < MAXIMAL_VARIABLE_COUNT : "Invalid variable " + variable;
        assert isNodeValidOrLeaf(low) && isNodeValidOrLeaf(high) : "Invalid children " + low + ", " + high;
        assert isLeaf(low) || variable < variableOf(low) : "Variable " + variable + " does not precede low " + low;
        assert isLeaf(high) || variable < variableOf(high) : "Variable " + variable + " does not precede high " + high;

        if (low == high) {
            return low;
        }

        int hashCode = HashUtil.hash(variable, low, high);
        int[] nodes = this.nodes;
        int[] tree = this.tree;
        int currentLookupNode = hashToChainStart[hashToTable(hashCode)];

        int chainLookups = 1;
        this.hashChainLookups += 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (dataGetVariable(nodes[currentLookupNode]) == variable
                    && tree[2 * currentLookupNode] == low
                    && tree[2 * currentLookupNode + 1] == high) {
                this.hashChainLookupLength += chainLookups;
                this.hashChainLookupHit += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        this.hashChainLookupLength += chainLookups;

        assert freeNodeCount > 0;
        if (freeNodeCount <= 1) {
            // Keep the last free node as anchor of the free chain. The children need to survive a potential GC.
            pushToWorkStack(low);
            pushToWorkStack(high);
            ensureCapacity();
            popWorkStack(2);
        }

        int freeNode = firstFreeNode;
        firstFreeNode = hashChain[freeNode];
        freeNodeCount -= 1;
        assert !isNodeValidOrLeaf(freeNode) : "Overwriting existing node " + freeNode;
        assert FIRST_NODE <= firstFreeNode && firstFreeNode < tableSize() : "Invalid free node " + firstFreeNode;

        this.nodes[freeNode] = dataMake(variable);
        this.tree[2 * freeNode] = low;
        this.tree[2 * freeNode + 1] = high;
        if (biggestValidNode < freeNode) {
            biggestValidNode = freeNode;
        }
        connectHashList(freeNode, hashCode);
        createdNodes += 1;
        return freeNode;
    }

    // Work stack

    private void ensureWorkStackSize(int size) {
        if (size < workStack.length) {
            return;
        }
        workStack = Arrays.copyOf(workStack, Math.max(workStack.length * 2, size + 1));
    }

    boolean isWorkStackEmpty() {
        return workStackIndex == 0;
    }

    int workStackSize() {
        return workStackIndex;
    }

    /**
     * Pushes the given node onto the stack. While a node is on the work stack, neither it nor its descendants
     * will be garbage collected.
     *
     * @return The given {@code node}, to be used for chaining.
     */
    int pushToWorkStack(int node) {
        assert isNodeValidOrLeaf(node);
        ensureWorkStackSize(workStackIndex);
        workStack[workStackIndex] = node;
        workStackIndex += 1;
        return node;
    }

    void popWorkStack() {
        assert !isWorkStackEmpty();
        workStackIndex -= 1;
    }

    void popWorkStack(int amount) {
        assert workStackIndex >= amount;
        workStackIndex -= amount;
    }

    // Reference counting

    /**
     * Returns the reference count of the given node or {@literal -1} for leaves and saturated nodes.
     */
    int referenceCount(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return -1;
        }
        int metadata = nodes[node];
        if (dataIsSaturated(metadata)) {
            return -1;
        }
        return dataGetReferenceCountUnsafe(metadata);
    }

    int reference(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return node;
        }
        int metadata = nodes[node];
        if (dataIsSaturated(metadata)) {
            return node;
        }
        nodes[node] = dataIncreaseReferenceCount(metadata);
        if (node > biggestReferencedNode) {
            biggestReferencedNode = node;
        }
        return node;
    }

    int dereference(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return node;
        }
        int metadata = nodes[node];
        if (dataIsSaturated(metadata)) {
            return node;
        }
        int referenceCount = dataGetReferenceCountUnsafe(metadata);
        assert referenceCount > 0 : "Dereferencing unreferenced node " + node;
        if (referenceCount == 1) {
            // Only an approximation: children may be kept alive by other nodes and vice versa.
            approximateDeadNodeCount += 1;
            if (node == biggestReferencedNode) {
                int newBiggest = NOT_A_NODE;
                for (int i = biggestReferencedNode - 1; i >= FIRST_NODE; i--) {
                    if (dataIsReferencedOrSaturated(nodes[i])) {
                        newBiggest = i;
                        break;
                    }
                }
                biggestReferencedNode = newBiggest;
            }
        }
        nodes[node] = dataDecreaseReferenceCount(metadata);
        return node;
    }

    /**
     * Pins the given node, it will never be reclaimed.
     */
    int saturateNode(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return node;
        }
        if (node > biggestReferencedNode) {
            biggestReferencedNode = node;
        }
        nodes[node] = dataSaturate(nodes[node]);
        return node;
    }

    boolean isNodeSaturated(int node) {
        assert isNodeValidOrLeaf(node);
        return isLeaf(node) || dataIsSaturated(nodes[node]);
    }

    // Memory management

    long garbageCollectionCount() {
        return garbageCollectionCount;
    }

    int approximateDeadNodeCount() {
        return approximateDeadNodeCount;
    }

    /**
     * Perform garbage collection by freeing up dead nodes.
     *
     * @return Number of freed nodes.
     */
    int forceGc() {
        return doGarbageCollection(0);
    }

    /**
     * Tries to free space by garbage collection and, if that does not yield enough free nodes, re-sizes the table,
     * recreating hashes.
     */
    private void ensureCapacity() {
        assert check();

        if (minimumFreeNodeAfterGc < 1.0 && approximateDeadNodeCount > 0) {
            logger.log(Level.FINE, "Running GC on {0} has size {1} and approximately {2} dead nodes", new Object[] {
                this, tableSize(), approximateDeadNodeCount
            });

            @SuppressWarnings("NumericCastThatLosesPrecision")
            int minimumFreeNodeCount = Math.max(2, (int) (tableSize() * minimumFreeNodeAfterGc));
            int clearedNodes = doGarbageCollection(minimumFreeNodeCount);
            if (clearedNodes == -1) {
                logger.log(Level.FINE, "Not enough free nodes");
            } else {
                logger.log(Level.FINE, "Collected {0} nodes", clearedNodes);
                return;
            }
        }

        growCount += 1;
        int oldSize = tableSize();
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = Math.min(MAXIMAL_NODE_COUNT, Primes.nextPrime((int) Math.ceil(oldSize * growthFactor)));
        checkState(oldSize < newSize, "Node table cannot grow beyond %d nodes", oldSize);

        logger.log(Level.FINE, "Growing the table of {0} from {1} to {2}", new Object[] {this, oldSize, newSize});

        nodes = Arrays.copyOf(this.nodes, newSize);
        tree = Arrays.copyOf(this.tree, 2 * newSize);
        hashChain = Arrays.copyOf(this.hashChain, newSize);
        // Bucket positions depend on the size, rebuild completely
        hashToChainStart = new int[newSize];

        int[] nodes = this.nodes;
        int[] hashChain = this.hashChain;
        Arrays.fill(nodes, oldSize, newSize, dataMakeInvalid());

        int firstFreeNode = oldSize;
        int freeNodeCount = newSize - oldSize;

        // Build the free chain downwards towards the first free node
        hashChain[newSize - 1] = FIRST_NODE;
        for (int node = newSize - 2; node >= oldSize; node--) {
            hashChain[node] = node + 1;
        }
        for (int node = oldSize - 1; node >= FIRST_NODE; node--) {
            if (!dataIsValid(nodes[node])) {
                hashChain[node] = firstFreeNode;
                firstFreeNode = node;
                freeNodeCount += 1;
            }
        }
        // Second pass for the existing nodes, the free chain must not be overwritten
        for (int node = oldSize - 1; node >= FIRST_NODE; node--) {
            if (dataIsValid(nodes[node])) {
                connectHashList(node, hashCode(node));
            }
        }

        this.firstFreeNode = firstFreeNode;
        this.freeNodeCount = freeNodeCount;

        assert check();
        logger.log(Level.FINE, "Finished growing the table");
    }

    private int doGarbageCollection(int minimumFreeNodeCount) {
        assert check();
        assert isNoneMarked();
        long startTimestamp = System.currentTimeMillis();

        int referencedNodes = 0;
        for (int i = 0; i < workStackIndex; i++) {
            referencedNodes += markAllUnmarkedBelow(workStack[i]);
        }

        int biggestValidNode = this.biggestValidNode;
        int[] nodes = this.nodes;
        int[] hashChain = this.hashChain;

        for (int i = FIRST_NODE; i <= biggestReferencedNode; i++) {
            int metadata = nodes[i];
            if (dataIsValid(metadata) && dataIsReferencedOrSaturated(metadata)) {
                referencedNodes += markAllUnmarkedBelow(i);
            }
        }

        int freeNodeCount = (tableSize() - FIRST_NODE) - referencedNodes;
        if (freeNodeCount < minimumFreeNodeCount) {
            unMarkAll();
            return -1;
        }

        Arrays.fill(hashToChainStart, NOT_A_NODE);
        int previousFreeNodes = this.freeNodeCount;
        int firstFreeNode = FIRST_NODE;

        // Connect all definitely invalid nodes in the free node chain
        for (int i = tableSize() - 1; i > biggestValidNode; i--) {
            hashChain[i] = firstFreeNode;
            firstFreeNode = i;
        }

        // Unmarked nodes are dead, free them. Marked nodes stay and are re-inserted into their chain.
        for (int node = biggestValidNode; node >= FIRST_NODE; node--) {
            int metadata = nodes[node];
            int unmarkedData = dataClearMark(metadata);
            if (metadata == unmarkedData) {
                nodes[node] = dataMakeInvalid();
                hashChain[node] = firstFreeNode;
                firstFreeNode = node;
                if (node == biggestValidNode) {
                    biggestValidNode--;
                }
            } else {
                nodes[node] = unmarkedData;
                connectHashList(node, hashCode(node));
            }
        }

        this.biggestValidNode = biggestValidNode;
        this.firstFreeNode = firstFreeNode;
        this.freeNodeCount = freeNodeCount;
        approximateDeadNodeCount = 0;

        assert check();

        int collectedNodes = freeNodeCount - previousFreeNodes;
        this.garbageCollectedNodeCount += collectedNodes;
        this.garbageCollectionCount += 1;
        this.garbageCollectionTime += System.currentTimeMillis() - startTimestamp;
        return collectedNodes;
    }

    private int hashCode(int node) {
        return HashUtil.hash(dataGetVariable(nodes[node]), tree[2 * node], tree[2 * node + 1]);
    }

    private void connectHashList(int node, int hashCode) {
        assert isNodeValid(node);
        int position = hashToTable(hashCode);
        hashChain[node] = hashToChainStart[position];
        hashToChainStart[position] = node;
    }

    private int hashToTable(int hashCode) {
        int mod = hashCode % nodes.length;
        return mod < 0 ? mod + nodes.length : mod;
    }

    // Marking

    private boolean isNoneMarked() {
        for (int i = FIRST_NODE; i < nodes.length; i++) {
            if (dataIsMarked(nodes[i])) {
                return false;
            }
        }
        return true;
    }

    private int markAllUnmarkedBelow(int node) {
        /* Does not descend below marked nodes, hence every marked node must have all of its descendants marked. */
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return 0;
        }
        int metadata = nodes[node];
        int markedData = dataSetMark(metadata);
        if (metadata == markedData) {
            return 0;
        }
        nodes[node] = markedData;
        return 1 + markAllUnmarkedBelow(tree[2 * node]) + markAllUnmarkedBelow(tree[2 * node + 1]);
    }

    private int unMarkAllMarkedBelow(int node) {
        assert isNodeValidOrLeaf(node);
        if (isLeaf(node)) {
            return 0;
        }
        int metadata = nodes[node];
        int unmarkedData = dataClearMark(metadata);
        if (metadata == unmarkedData) {
            return 0;
        }
        nodes[node] = unmarkedData;
        return 1 + unMarkAllMarkedBelow(tree[2 * node]) + unMarkAllMarkedBelow(tree[2 * node + 1]);
    }

    private int unMarkAll() {
        int unmarkedCount = 0;
        int[] nodes = this.nodes;
        for (int i = FIRST_NODE; i <= biggestValidNode; i++) {
            int metadata = nodes[i];
            if (dataIsValid(metadata) && dataIsMarked(metadata)) {
                unmarkedCount++;
                nodes[i] = dataClearMark(metadata);
            }
        }
        assert isNoneMarked();
        return unmarkedCount;
    }

    // Reading

    int tableSize() {
        return nodes.length;
    }

    int freeNodeCount() {
        return freeNodeCount;
    }

    /**
     * Counts the nodes reachable from referenced or saturated nodes, <b>excluding</b> the leaves.
     */
    int activeNodeCount() {
        assert isNoneMarked();
        int count = 0;
        for (int node = FIRST_NODE; node <= biggestReferencedNode; node++) {
            int metadata = nodes[node];
            if (dataIsValid(metadata) && dataIsReferencedOrSaturated(metadata)) {
                count += markAllUnmarkedBelow(node);
            }
        }
        int unmarkedCount = unMarkAll();
        assert count == unmarkedCount;
        return count;
    }

    /**
     * Counts the number of decision nodes below (and including) the specified {@code node}.
     */
    int nodeCount(int node) {
        assert isNodeValidOrLeaf(node);
        assert isNoneMarked();
        int count = markAllUnmarkedBelow(node);
        if (count > 0) {
            int unmarked = unMarkAllMarkedBelow(node);
            assert count == unmarked : "Expected " + count + " but only unmarked " + unmarked;
        }
        return count;
    }

    /**
     * Computes the ranks of all variables tested somewhere below {@code node}. As the table is reduced, these are
     * exactly the variables the function depends on.
     */
    BitSet support(int node) {
        BitSet support = new BitSet();
        forEachNodeBelowOnce(node, true, (n, variable) -> support.set(variable));
        return support;
    }

    boolean evaluate(int node, BitSet assignment) {
        int current = node;
        while (current >= FIRST_NODE) {
            assert isNodeValid(current);
            current = assignment.get(dataGetVariable(nodes[current])) ? tree[2 * current + 1] : tree[2 * current];
        }
        assert isLeaf(current);
        return current == TRUE_NODE;
    }

    /**
     * Lists all nodes reachable from {@code node}, each exactly once and including the leaves, with every node
     * appearing before its children.
     */
    int[] preorder(int node) {
        IntStream.Builder builder = IntStream.builder();
        forEachNodeBelowOnce(node, true, (n, variable) -> builder.add(n));
        addReachableLeaves(node, builder);
        return builder.build().toArray();
    }

    /**
     * Lists all nodes reachable from {@code node}, each exactly once and including the leaves, with every node
     * appearing after its children.
     */
    int[] postorder(int node) {
        IntStream.Builder builder = IntStream.builder();
        addReachableLeaves(node, builder);
        forEachNodeBelowOnce(node, false, (n, variable) -> builder.add(n));
        return builder.build().toArray();
    }

    private void addReachableLeaves(int node, IntStream.Builder builder) {
        if (isLeaf(node)) {
            builder.add(node);
        } else {
            // A reduced decision node represents a non-constant function, hence reaches both leaves
            builder.add(FALSE_NODE);
            builder.add(TRUE_NODE);
        }
    }

    private void forEachNodeBelowOnce(int node, boolean preorder, NodeVisitor action) {
        assert isNodeValidOrLeaf(node);
        assert isNoneMarked();
        doForEachNodeBelowOnce(node, preorder, action);
        unMarkAllMarkedBelow(node);
    }

    private void doForEachNodeBelowOnce(int node, boolean preorder, NodeVisitor action) {
        if (isLeaf(node)) {
            return;
        }
        int metadata = nodes[node];
        int markedData = dataSetMark(metadata);
        if (metadata == markedData) {
            return;
        }
        nodes[node] = markedData;
        if (preorder) {
            action.visit(node, dataGetVariable(metadata));
        }
        doForEachNodeBelowOnce(tree[2 * node], preorder, action);
        doForEachNodeBelowOnce(tree[2 * node + 1], preorder, action);
        if (!preorder) {
            action.visit(node, dataGetVariable(metadata));
        }
    }

    @FunctionalInterface
    private interface NodeVisitor {
        void visit(int node, int variable);
    }

    // Integrity checks and utility

    /**
     * Performs integrity / invariant checks.
     *
     * @return True. This way, check can easily be called by an {@code assert} statement.
     */
    @SuppressWarnings("PMD.AvoidDeeplyNestedIfStmts")
    boolean check() {
        logger.log(Level.FINER, "Running integrity check");
        checkState(biggestReferencedNode <= biggestValidNode, "Referenced node beyond valid nodes");

        if (biggestValidNode >= FIRST_NODE) {
            checkState(dataIsValid(nodes[biggestValidNode]), "Node %d is not valid", biggestValidNode);
        }
        for (int i = biggestValidNode + 1; i < tableSize(); i++) {
            checkState(!dataIsValid(nodes[i]), "Node (%s) is valid", nodeToString(i));
        }
        if (biggestReferencedNode >= FIRST_NODE) {
            checkState(dataIsReferencedOrSaturated(nodes[biggestReferencedNode]),
                    "Node (%s) is not referenced", nodeToString(biggestReferencedNode));
        }
        for (int i = biggestReferencedNode + 1; i < tableSize(); i++) {
            checkState(!dataIsReferencedOrSaturated(nodes[i]), "Node (%s) is referenced", nodeToString(i));
        }

        int validCount = 0;
        Set<Triple> triples = new HashSet<>();
        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            int metadata = nodes[node];
            if (dataIsReferencedOrSaturated(metadata)) {
                checkState(dataIsValid(metadata), "Node (%s) is referenced but invalid", nodeToString(node));
            }
            if (!dataIsValid(metadata)) {
                continue;
            }
            validCount++;

            int variable = dataGetVariable(metadata);
            int low = tree[2 * node];
            int high = tree[2 * node + 1];
            checkState(low != high, "Node (%s) is redundant", nodeToString(node));
            for (int child : new int[] {low, high}) {
                checkState(isNodeValidOrLeaf(child), "Invalid child entry (%s) -> %d", nodeToString(node), child);
                if (!isLeaf(child)) {
                    checkState(variable < dataGetVariable(nodes[child]),
                            "(%s) -> (%s) does not descend the order", nodeToString(node), nodeToString(child));
                }
            }
            checkState(triples.add(new Triple(variable, low, high)), "Duplicate entry (%s)", nodeToString(node));

            // Each node has to be found in its own hash chain
            int chainPosition = hashToChainStart[hashToTable(hashCode(node))];
            boolean found = false;
            while (chainPosition != NOT_A_NODE) {
                if (chainPosition == node) {
                    found = true;
                    break;
                }
                chainPosition = hashChain[chainPosition];
            }
            checkState(found, "(%s) is not contained in its hash list", nodeToString(node));
        }

        checkState(validCount == tableSize() - freeNodeCount - FIRST_NODE,
                "Invalid # of free nodes: #live=%d, size=%d, free=%d", validCount, tableSize(), freeNodeCount);

        int currentFreeNode = firstFreeNode;
        int freeChainLength = 0;
        do {
            checkState(!dataIsValid(nodes[currentFreeNode]), "Node %d in free node chain is valid", currentFreeNode);
            int nextFreeNode = hashChain[currentFreeNode];
            // This also excludes possible loops
            checkState(nextFreeNode == FIRST_NODE || currentFreeNode < nextFreeNode,
                    "Free node chain is not well ordered, %d <= %d", nextFreeNode, currentFreeNode);
            currentFreeNode = nextFreeNode;
            freeChainLength += 1;
        } while (currentFreeNode != FIRST_NODE && freeChainLength <= freeNodeCount);
        checkState(freeChainLength == freeNodeCount,
                "Free node chain has length %d, expected %d", freeChainLength, freeNodeCount);

        return true;
    }

    String getStatistics() {
        int referencedNodes = 0;
        int saturatedNodes = 0;
        int validNodes = 0;
        for (int node = FIRST_NODE; node <= biggestValidNode; node++) {
            int metadata = nodes[node];
            if (dataIsValid(metadata)) {
                validNodes += 1;
                if (dataIsReferencedOrSaturated(metadata)) {
                    referencedNodes += 1;
                    if (dataIsSaturated(metadata)) {
                        saturatedNodes += 1;
                    }
                }
            }
        }

        return String.format(
                "Node table statistics:%n"
                        + "Table Size: %1$d, (largest ref: %2$d), %3$d created nodes%n"
                        + "%4$d valid nodes, %5$d referenced (%6$d saturated)%n"
                        + "Hash table: %7$d lookups, %8$.2f avg. len, %9$d hits%n"
                        + "%10$d GC runs (%11$.2f s), %12$d freed, %13$d grows",
                tableSize(),
                biggestReferencedNode,
                createdNodes,
                validNodes,
                referencedNodes,
                saturatedNodes,
                hashChainLookups,
                hashChainLookups == 0 ? 0.0 : hashChainLookupLength * 1.0 / hashChainLookups,
                hashChainLookupHit,
                garbageCollectionCount,
                garbageCollectionTime / 1000.0,
                garbageCollectedNodeCount,
                growCount);
    }

    String nodeToString(int node) {
        if (isLeaf(node)) {
            return node == TRUE_NODE ? "TRUE" : "FALSE";
        }
        int metadata = nodes[node];
        if (!dataIsValid(metadata)) {
            return String.format("%5d| == INVALID ==", node);
        }
        String referenceCountString = dataIsSaturated(metadata)
                ? "SAT"
                : String.format("%3d", dataGetReferenceCountUnsafe(metadata));
        return String.format("%5d|%3d|%s|%d,%d",
                node, dataGetVariable(metadata), referenceCountString, tree[2 * node], tree[2 * node + 1]);
    }

    private static final class Triple {
        private final int variable;
        private final int low;
        private final int high;

        Triple(int variable, int low, int high) {
            this.variable = variable;
            this.low = low;
            this.high = high;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Triple)) {
                return false;
            }
            Triple other = (Triple) o;
            return variable == other.variable && low == other.low && high == other.high;
        }

        @Override
        public int hashCode() {
            return HashUtil.mixedHash(variable, low, high);
        }
    }
}
