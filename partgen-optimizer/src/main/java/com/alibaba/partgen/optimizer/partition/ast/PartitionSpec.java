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

package com.alibaba.partgen.optimizer.partition.ast;

import com.alibaba.partgen.optimizer.partition.PartitionStrategy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * {@code PARTITION BY strategy (columns)} or {@code SUBPARTITION BY ...}, with the definition of that
 * level (absent on a sub-partition level whose partitions are given per element) and the
 * specification of the next level down.
 */
public class PartitionSpec {

    private final PartitionStrategy strategy;
    private final List<String> keyColumns;
    private final PartitionDefinition definition;
    private final PartitionSpec subSpec;
    private final int location;

    public PartitionSpec(PartitionStrategy strategy, List<String> keyColumns, PartitionDefinition definition,
                         PartitionSpec subSpec, int location) {
        this.strategy = strategy;
        this.keyColumns = Collections.unmodifiableList(new ArrayList<>(keyColumns));
        this.definition = definition;
        this.subSpec = subSpec;
        this.location = location;
    }

    public PartitionStrategy getStrategy() {
        return strategy;
    }

    public List<String> getKeyColumns() {
        return keyColumns;
    }

    public PartitionDefinition getDefinition() {
        return definition;
    }

    public PartitionSpec getSubSpec() {
        return subSpec;
    }

    public int getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PartitionSpec that = (PartitionSpec) o;
        return location == that.location && strategy == that.strategy && Objects.equals(keyColumns, that.keyColumns)
            && Objects.equals(definition, that.definition) && Objects.equals(subSpec, that.subSpec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, keyColumns, definition, subSpec, location);
    }

    @Override
    public String toString() {
        return strategy + " " + keyColumns;
    }
}
