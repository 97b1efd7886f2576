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

import com.alibaba.partgen.optimizer.partition.ast.ColumnEncodingDirective;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog view of a partitioned table (the root, or an intermediate partition that is itself
 * partitioned): what new partitions are generated under and what they inherit.
 */
public class PartitionedRelation {

    private final String schemaName;
    private final String name;
    private final List<ColumnMeta> columns;
    private final PartitionKey partitionKey;
    /**
     * Number of partitioned ancestors, 0 for the root table.
     */
    private final int level;
    private final Map<String, Object> options;
    private final String accessMethod;
    private final String tablespace;
    private final List<ColumnEncodingDirective> columnEncodings;

    private PartitionedRelation(Builder builder) {
        this.schemaName = builder.schemaName;
        this.name = builder.name;
        this.columns = ImmutableList.copyOf(builder.columns);
        this.partitionKey = builder.partitionKey;
        this.level = builder.level;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
        this.accessMethod = builder.accessMethod;
        this.tablespace = builder.tablespace;
        this.columnEncodings = ImmutableList.copyOf(builder.columnEncodings);
    }

    public static Builder builder(String schemaName, String name) {
        return new Builder(schemaName, name);
    }

    public ColumnMeta getColumn(String columnName) {
        for (ColumnMeta column : columns) {
            if (column.getName().equalsIgnoreCase(columnName)) {
                return column;
            }
        }
        return null;
    }

    public String getSchemaName() {
        return schemaName;
    }

    public String getName() {
        return name;
    }

    public List<ColumnMeta> getColumns() {
        return columns;
    }

    public PartitionKey getPartitionKey() {
        return partitionKey;
    }

    public int getLevel() {
        return level;
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

    @Override
    public String toString() {
        return schemaName == null ? name : schemaName + "." + name;
    }

    public static class Builder {
        private final String schemaName;
        private final String name;
        private List<ColumnMeta> columns = ImmutableList.of();
        private PartitionKey partitionKey;
        private int level;
        private Map<String, Object> options = ImmutableMap.of();
        private String accessMethod;
        private String tablespace;
        private List<ColumnEncodingDirective> columnEncodings = ImmutableList.of();

        private Builder(String schemaName, String name) {
            this.schemaName = schemaName;
            this.name = name;
        }

        public Builder columns(List<ColumnMeta> columns) {
            this.columns = columns;
            return this;
        }

        public Builder partitionKey(PartitionKey partitionKey) {
            this.partitionKey = partitionKey;
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder options(Map<String, Object> options) {
            this.options = options == null ? ImmutableMap.of() : options;
            return this;
        }

        public Builder accessMethod(String accessMethod) {
            this.accessMethod = accessMethod;
            return this;
        }

        public Builder tablespace(String tablespace) {
            this.tablespace = tablespace;
            return this;
        }

        public Builder columnEncodings(List<ColumnEncodingDirective> columnEncodings) {
            this.columnEncodings = columnEncodings == null ? ImmutableList.of() : columnEncodings;
            return this;
        }

        public PartitionedRelation build() {
            return new PartitionedRelation(this);
        }
    }
}
