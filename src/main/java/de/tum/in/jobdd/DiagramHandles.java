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

import de.tum.in.jobdd.ObddManagerImpl.DiagramImpl;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import java.util.function.IntFunction;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The diagrams handed out by one manager, at most one per node.
 *
 * <p>Every node with a live handle holds exactly one reference in the {@link NodeTable}. Handles of permanent
 * nodes (leaves and saturated nodes) are held strongly and do not count references. All other handles are held
 * weakly. Once the JVM dropped a handle, its reference is released by {@link #releaseCollected()}, which also runs
 * whenever a new handle is created. Afterwards the table may reclaim the node.</p>
 *
 * <p>A handle which was cleared but is still queued may be superseded by a fresh handle for the same node. The
 * fresh handle then owns the node's reference and the superseded one releases nothing.</p>
 *
 * <p>Not thread safe, the manager calls this under its write lock.</p>
 */
final class DiagramHandles {
    private static final Logger logger = Logger.getLogger(DiagramHandles.class.getName());

    private final NodeTable table;
    private final IntFunction<DiagramImpl> factory;

    private final Map<Integer, DiagramImpl> permanent = new HashMap<>();
    private final Map<Integer, Handle> tracked = new HashMap<>();
    private final ReferenceQueue<DiagramImpl> cleared = new ReferenceQueue<>();

    DiagramHandles(NodeTable table, IntFunction<DiagramImpl> factory) {
        this.table = table;
        this.factory = factory;
    }

    /**
     * Returns the diagram of {@code node}, creating and registering it if there is no live one.
     */
    DiagramImpl of(int node) {
        if (table.isNodeSaturated(node)) {
            return permanent.computeIfAbsent(node, factory::apply);
        }

        Handle handle = tracked.get(node);
        if (handle != null) {
            DiagramImpl diagram = handle.get();
            if (diagram != null) {
                return diagram;
            }
        }
        releaseCollected();

        if (tracked.containsKey(node)) {
            // Cleared but not queued yet, the new handle takes over the reference of the old one
            assert table.referenceCount(node) == 1 : describeCount(node, 1);
        } else {
            assert table.referenceCount(node) == 0 : describeCount(node, 0);
            table.reference(node);
        }

        DiagramImpl diagram = factory.apply(node);
        tracked.put(node, new Handle(diagram, cleared));
        return diagram;
    }

    /**
     * Releases the reference of every node whose diagram has been collected by the JVM.
     *
     * @return the number of released nodes
     */
    int releaseCollected() {
        int released = 0;
        Handle handle;
        while ((handle = (Handle) cleared.poll()) != null) {
            // Only the current handle of a node owns its reference
            if (tracked.get(handle.node) == handle) {
                tracked.remove(handle.node);
                assert table.referenceCount(handle.node) == 1 : describeCount(handle.node, 1);
                table.dereference(handle.node);
                released += 1;
            }
        }
        if (released > 0) {
            logger.log(Level.FINEST, "Released {0} collected diagrams", released);
        }
        return released;
    }

    int trackedCount() {
        return tracked.size();
    }

    int permanentCount() {
        return permanent.size();
    }

    private String describeCount(int node, int expected) {
        return String.format("Node %d has %d references, expected %d", node, table.referenceCount(node), expected);
    }

    private static final class Handle extends WeakReference<DiagramImpl> {
        private final int node;

        Handle(DiagramImpl diagram, ReferenceQueue<DiagramImpl> queue) {
            super(diagram, queue);
            this.node = diagram.node();
        }
    }
}
