/*
 * Copyright [2013-2021], Alibaba Group Holding Limited
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.alibaba.partgen.optimizer.partition.bound;

import com.alibaba.partgen.optimizer.partition.PartitionStrategy;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Resolved bound of a generated partition. A RANGE bound may miss its lower or upper datums until
 * implicit bounds are filled in; a LIST bound holds the values of the partition, where {@code null}
 * stands for NULL.
 */
public final class PartitionBound {

    private static final PartitionBound DEFAULT_BOUND = new PartitionBound(PartitionStrategy.DEFAULT, null, null, null);

    private final PartitionStrategy strategy;
    private final List<RangeDatum> lower;
    private final List<RangeDatum> upper;
    private final List<Object> listValues;

    private PartitionBound(PartitionStrategy strategy, List<RangeDatum> lower, List<RangeDatum> upper,
                           List<Object> listValues) {
        this.strategy = strategy;
        this.lower = lower == null ? null : ImmutableList.copyOf(lower);
        this.upper = upper == null ? null : ImmutableList.copyOf(upper);
        this.listValues = listValues == null ? null : Collections.unmodifiableList(new ArrayList<>(listValues));
    }

    public static PartitionBound range(List<RangeDatum> lower, List<RangeDatum> upper) {
        return new PartitionBound(PartitionStrategy.RANGE, lower, upper, null);
    }

    public static PartitionBound list(List<Object> values) {
        return new PartitionBound(PartitionStrategy.LIST, null, null, values);
    }

    public static PartitionBound defaultBound() {
        return DEFAULT_BOUND;
    }

    public PartitionBound withLower(List<RangeDatum> newLower) {
        return new PartitionBound(strategy, newLower, upper, listValues);
    }

    public PartitionBound withUpper(List<RangeDatum> newUpper) {
        return new PartitionBound(strategy, lower, newUpper, listValues);
    }

    public PartitionStrategy getStrategy() {
        return strategy;
    }

    public boolean isDefault() {
        return strategy == PartitionStrategy.DEFAULT;
    }

    public boolean hasLower() {
        return lower != null;
    }

    public boolean hasUpper() {
        return upper != null;
    }

    public List<RangeDatum> getLower() {
        return lower;
    }

    public List<RangeDatum> getUpper() {
        return upper;
    }

    public List<Object> getListValues() {
        return listValues;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PartitionBound that = (PartitionBound) o;
        return strategy == that.strategy && Objects.equals(lower, that.lower) && Objects.equals(upper, that.upper)
            && Objects.equals(listValues, that.listValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, lower, upper, listValues);
    }

    @Override
    public String toString() {
        switch (strategy) {
        case DEFAULT:
            return "DEFAULT";
        case LIST:
            return "FOR VALUES IN (" + Joiner.on(", ").useForNull("NULL").join(listValues) + ")";
        default:
            return "FOR VALUES FROM (" + (lower == null ? "?" : Joiner.on(", ").join(lower)) + ") TO ("
                + (upper == null ? "?" : Joiner.on(", ").join(upper)) + ")";
        }
    }
}
