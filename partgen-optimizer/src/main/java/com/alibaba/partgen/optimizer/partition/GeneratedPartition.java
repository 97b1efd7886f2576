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

package com.alibaba.partgen.optimizer.partition;

import com.alibaba.partgen.optimizer.partition.ast.ColumnEncodingDirective;
import com.alibaba.partgen.optimizer.partition.ast.PartitionSpec;
import com.alibaba.partgen.optimizer.partition.bound.PartitionBound;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A partition to create: the child table's name, its resolved bound and everything it inherited
 * from the parent. {@link #getSubPartitionSpec()} carries the definition of its own partitions, if
 * any.
 */
public final class GeneratedPartition {

    private final String schemaName;
    private final String name;
    private final String parentName;
    private final PartitionBound bound;
    private final Map<String, Object> options;
    private final String accessMethod;
    private final String tablespace;
    private final List<ColumnEncodingDirective> columnEncodings;
    private final PartitionSpec subPartitionSpec;

    public GeneratedPartition(String schemaName, String name, String parentName, PartitionBound bound,
                              Map<String, Object> options, String accessMethod, String tablespace,
                              List<ColumnEncodingDirective> columnEncodings, PartitionSpec subPartitionSpec) {
        this.schemaName = schemaName;
        this.name = name;
        this.parentName = parentName;
        this.bound = bound;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
        this.accessMethod = accessMethod;
        this.tablespace = tablespace;
        this.columnEncodings = Collections.unmodifiableList(new ArrayList<>(columnEncodings));
        this.subPartitionSpec = subPartitionSpec;
    }

    public GeneratedPartition withBound(PartitionBound newBound) {
        return new GeneratedPartition(schemaName, name, parentName, newBound, options, accessMethod, tablespace,
            columnEncodings, subPartitionSpec);
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getName() {
        return name;
    }

    public String getParentName() {
        return parentName;
    }

    public PartitionBound getBound() {
        return bound;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public String getAccessMethod() {
        return accessMethod;
    }

    public String getTablespace() {
        return tablespace;
    }

    public List<ColumnEncodingDirective> getColumnEncodings() {
        return columnEncodings;
    }

    public PartitionSpec getSubPartitionSpec() {
        return subPartitionSpec;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GeneratedPartition that = (GeneratedPartition) o;
        return Objects.equals(schemaName, that.schemaName) && Objects.equals(name, that.name)
            && Objects.equals(parentName, that.parentName) && Objects.equals(bound, that.bound)
            && Objects.equals(options, that.options) && Objects.equals(accessMethod, that.accessMethod)
            && Objects.equals(tablespace, that.tablespace) && Objects.equals(columnEncodings, that.columnEncodings)
            && Objects.equals(subPartitionSpec, that.subPartitionSpec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schemaName, name, parentName, bound, options, accessMethod, tablespace, columnEncodings,
            subPartitionSpec);
    }

    @Override
    public String toString() {
        return name + " PARTITION OF " + parentName + " " + bound;
    }
}
