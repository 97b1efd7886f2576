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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One {@code PARTITION name bound WITH (...) TABLESPACE ts ...} entry, or the
 * {@code DEFAULT PARTITION name} entry, of a partition definition. Read only.
 */
public class PartitionDefinitionElement {

    private final String name;
    private final PartitionBoundSpec boundSpec;
    private final boolean isDefault;
    private final Map<String, Object> options;
    private final String accessMethod;
    private final String tablespace;
    private final List<ColumnEncodingDirective> columnEncodings;
    private final PartitionDefinition subDefinition;
    private final int location;

    private PartitionDefinitionElement(Builder builder) {
        this.name = builder.name;
        this.boundSpec = builder.boundSpec;
        this.isDefault = builder.isDefault;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
        this.accessMethod = builder.accessMethod;
        this.tablespace = builder.tablespace;
        this.columnEncodings = Collections.unmodifiableList(new ArrayList<>(builder.columnEncodings));
        this.subDefinition = builder.subDefinition;
        this.location = builder.location;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public PartitionBoundSpec getBoundSpec() {
        return boundSpec;
    }

    public boolean isDefault() {
        return isDefault;
    }

    /**
     * Storage options of the {@code WITH} clause; empty when the element has none.
     */
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

    /**
     * Partitions of this element at the level below, used when that level has no template.
     */
    public PartitionDefinition getSubDefinition() {
        return subDefinition;
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
        PartitionDefinitionElement that = (PartitionDefinitionElement) o;
        return isDefault == that.isDefault && location == that.location && Objects.equals(name, that.name)
            && Objects.equals(boundSpec, that.boundSpec) && Objects.equals(options, that.options)
            && Objects.equals(accessMethod, that.accessMethod) && Objects.equals(tablespace, that.tablespace)
            && Objects.equals(columnEncodings, that.columnEncodings)
            && Objects.equals(subDefinition, that.subDefinition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, boundSpec, isDefault, options, accessMethod, tablespace, columnEncodings,
            subDefinition, location);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(isDefault ? "DEFAULT PARTITION" : "PARTITION");
        if (name != null) {
            sb.append(' ').append(name);
        }
        if (boundSpec != null) {
            sb.append(' ').append(boundSpec);
        }
        return sb.toString();
    }

    public static class Builder {
        private String name;
        private PartitionBoundSpec boundSpec;
        private boolean isDefault;
        private Map<String, Object> options = new LinkedHashMap<>();
        private String accessMethod;
        private String tablespace;
        private List<ColumnEncodingDirective> columnEncodings = new ArrayList<>();
        private PartitionDefinition subDefinition;
        private int location = PartitionValueExpr.UNKNOWN_LOCATION;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder bound(PartitionBoundSpec boundSpec) {
            this.boundSpec = boundSpec;
            return this;
        }

        public Builder asDefault() {
            this.isDefault = true;
            return this;
        }

        public Builder option(String key, Object value) {
            this.options.put(key, value);
            return this;
        }

        public Builder options(Map<String, Object> options) {
            this.options = new LinkedHashMap<>(options);
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

        public Builder columnEncoding(ColumnEncodingDirective directive) {
            this.columnEncodings.add(directive);
            return this;
        }

        public Builder columnEncodings(List<ColumnEncodingDirective> columnEncodings) {
            this.columnEncodings = new ArrayList<>(columnEncodings);
            return this;
        }

        public Builder subDefinition(PartitionDefinition subDefinition) {
            this.subDefinition = subDefinition;
            return this;
        }

        public Builder location(int location) {
            this.location = location;
            return this;
        }

        public PartitionDefinitionElement build() {
            return new PartitionDefinitionElement(this);
        }
    }
}
