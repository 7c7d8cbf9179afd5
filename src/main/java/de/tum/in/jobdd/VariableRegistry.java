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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Issues and deduplicates {@link Variable variables}. The order of registration defines the variable order,
 * i.e. the first registered variable has rank 0. Entries are never removed.
 *
 * <p>This class is not thread safe, the owning manager serializes access.</p>
 */
final class VariableRegistry {
    private static final Logger logger = Logger.getLogger(VariableRegistry.class.getName());
    private static final AtomicLong registryCounter = new AtomicLong();

    private final long id = registryCounter.incrementAndGet();

    private final Map<Key, Variable> variables = new HashMap<>();
    private final List<Variable> byRank = new ArrayList<>();
    private final int maximalVariableCount;

    VariableRegistry(int maximalVariableCount) {
        this.maximalVariableCount = maximalVariableCount;
    }

    Variable register(List<String> names, List<Integer> indices) {
        checkArgument(names != null && !names.isEmpty(), "Expected at least one name, got %s", names);
        checkArgument(indices != null, "Expected a (possibly empty) list of indices, got null");
        for (String name : names) {
            checkArgument(name != null, "Expected name to be a string, got null in %s", names);
        }
        for (Integer index : indices) {
            checkArgument(index != null, "Expected index to be an integer, got null in %s", indices);
            checkArgument(index >= 0, "Expected index to be >= 0, got %d", index);
        }

        Key key = new Key(ImmutableList.copyOf(names), ImmutableList.copyOf(indices));
        Variable existing = variables.get(key);
        if (existing != null) {
            return existing;
        }

        int rank = byRank.size();
        Util.checkState(rank < maximalVariableCount, "Cannot register more than %d variables", maximalVariableCount);
        Variable variable = new Variable(key.names, key.indices, rank, id);
        variables.put(key, variable);
        byRank.add(variable);
        logger.log(Level.FINER, "Registered variable {0} with rank {1}", new Object[] {variable, rank});
        return variable;
    }

    boolean contains(@Nullable Variable variable) {
        if (variable == null) {
            return false;
        }
        int rank = variable.rank();
        return rank < byRank.size() && byRank.get(rank) == variable;
    }

    int size() {
        return byRank.size();
    }

    Variable variableOfRank(int rank) {
        assert 0 <= rank && rank < byRank.size() : "No variable with rank " + rank;
        return byRank.get(rank);
    }

    List<Variable> variables() {
        return ImmutableList.copyOf(byRank);
    }

    private static final class Key {
        private final ImmutableList<String> names;
        private final ImmutableList<Integer> indices;
        private final int hashCode;

        Key(ImmutableList<String> names, ImmutableList<Integer> indices) {
            this.names = names;
            this.indices = indices;
            this.hashCode = Objects.hash(names, indices);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Key)) {
                return false;
            }
            Key other = (Key) o;
            return hashCode == other.hashCode && names.equals(other.names) && indices.equals(other.indices);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }
    }
}
