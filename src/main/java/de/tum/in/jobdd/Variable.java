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
import java.util.stream.Collectors;

/**
 * A symbolic Boolean variable. Variables are canonical: a {@link VariableRegistry} hands out exactly one
 * instance per combination of names and indices, hence equality is identity.
 *
 * <p>The {@link #rank() rank} of a variable is its position in the global variable order. Variables with
 * smaller rank are tested closer to the root of every diagram.</p>
 */
public final class Variable implements Comparable<Variable> {
    private final ImmutableList<String> names;
    private final ImmutableList<Integer> indices;
    private final int rank;
    private final long registryId;

    Variable(ImmutableList<String> names, ImmutableList<Integer> indices, int rank, long registryId) {
        assert !names.isEmpty() && rank >= 0;
        this.names = names;
        this.indices = indices;
        this.rank = rank;
        this.registryId = registryId;
    }

    /**
     * Returns the innermost name of this variable.
     */
    public String name() {
        return names.get(0);
    }

    public ImmutableList<String> names() {
        return names;
    }

    public ImmutableList<Integer> indices() {
        return indices;
    }

    public int rank() {
        return rank;
    }

    /**
     * Returns the fully qualified name, i.e. all names from outermost to innermost, separated by dots.
     */
    public String qualifiedName() {
        return String.join(".", names.reverse());
    }

    /**
     * Orders variables by rank. Variables of different managers may share a rank, those are ordered by the
     * creation order of their managers, so that the ordering is consistent with identity.
     */
    @Override
    public int compareTo(Variable other) {
        int comparison = Integer.compare(rank, other.rank);
        return comparison == 0 ? Long.compare(registryId, other.registryId) : comparison;
    }

    @Override
    public String toString() {
        if (indices.isEmpty()) {
            return qualifiedName();
        }
        return indices.stream().map(String::valueOf).collect(Collectors.joining(",", qualifiedName() + "[", "]"));
    }
}
