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

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class ObddConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final double DEFAULT_NODE_TABLE_FREE_NODE_PERCENTAGE = 0.10d;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;
    public static final int DEFAULT_MEMO_INITIAL_SIZE = 64;

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    @Value.Default
    public double minimumFreeNodePercentageAfterGc() {
        return DEFAULT_NODE_TABLE_FREE_NODE_PERCENTAGE;
    }

    /**
     * Initial capacity of the memo tables created for each top-level operation.
     */
    @Value.Default
    public int memoInitialSize() {
        return DEFAULT_MEMO_INITIAL_SIZE;
    }

    @Value.Default
    public boolean useGarbageCollection() {
        return true;
    }

    @Value.Default
    public boolean logStatisticsOnShutdown() {
        return false;
    }

    @Value.Check
    protected void check() {
        Util.checkArgument(initialSize() > 0, "Initial size must be positive, got %d", initialSize());
        Util.checkArgument(growthFactor() > 1.0, "Growth factor must be bigger than 1, got %s", growthFactor());
        Util.checkArgument(
                0.0 <= minimumFreeNodePercentageAfterGc() && minimumFreeNodePercentageAfterGc() <= 1.0,
                "Free node percentage must be in [0, 1], got %s",
                minimumFreeNodePercentageAfterGc());
        Util.checkArgument(memoInitialSize() > 0, "Memo size must be positive, got %d", memoInitialSize());
    }
}
