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

import java.util.List;
import java.util.Objects;

/**
 * {@code VALUES ((v1), (v2), ...)}; each inner list is one value tuple.
 */
public class ListPartitionBoundSpec implements PartitionBoundSpec {

    private final List<List<PartitionValueExpr>> values;
    private final int location;

    public ListPartitionBoundSpec(List<List<PartitionValueExpr>> values, int location) {
        this.values = values;
        this.location = location;
    }

    public List<List<PartitionValueExpr>> getValues() {
        return values;
    }

    @Override
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
        ListPartitionBoundSpec that = (ListPartitionBoundSpec) o;
        return location == that.location && Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values, location);
    }

    @Override
    public String toString() {
        return "VALUES " + values;
    }
}
