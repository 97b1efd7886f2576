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

package com.alibaba.partgen.optimizer.partition.meta;

import com.alibaba.partgen.common.utils.Assert;
import com.alibaba.partgen.optimizer.partition.PartitionStrategy;
import com.alibaba.partgen.optimizer.partition.datatype.OperatorResolver;
import com.google.common.collect.ImmutableList;

import java.util.Comparator;
import java.util.List;

/**
 * The partition key of one level of a partitioned table, with the ordering comparator of each key
 * column resolved up front.
 */
public class PartitionKey {

    private final PartitionStrategy strategy;
    private final List<ColumnMeta> columns;
    private final List<Comparator<Object>> comparators;

    public PartitionKey(PartitionStrategy strategy, List<ColumnMeta> columns, OperatorResolver resolver) {
        Assert.assertTrue(strategy != PartitionStrategy.DEFAULT, "a partition key cannot use the DEFAULT strategy");
        Assert.assertTrue(columns != null && !columns.isEmpty(), "partition key without columns");
        this.strategy = strategy;
        this.columns = ImmutableList.copyOf(columns);
        ImmutableList.Builder<Comparator<Object>> builder = ImmutableList.builder();
        for (ColumnMeta column : columns) {
            builder.add(resolver.resolveComparator(column.getDataType(), column.getCollation()));
        }
        this.comparators = builder.build();
    }

    public int compare(int columnIndex, Object value1, Object value2) {
        return comparators.get(columnIndex).compare(value1, value2);
    }

    public PartitionStrategy getStrategy() {
        return strategy;
    }

    public List<ColumnMeta> getColumns() {
        return columns;
    }

    public ColumnMeta getColumn(int index) {
        return columns.get(index);
    }

    public int getColumnCount() {
        return columns.size();
    }
}
