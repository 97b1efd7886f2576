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
import java.util.List;
import java.util.Objects;

/**
 * The parenthesized list of partition elements of one level, with the {@code COLUMN ... ENCODING}
 * directives given at that level. A template definition ({@code SUBPARTITION TEMPLATE}) is applied to
 * every partition of the level above.
 */
public class PartitionDefinition {

    private final List<PartitionDefinitionElement> elements;
    private final List<ColumnEncodingDirective> encodings;
    private final boolean template;
    private final int location;

    public PartitionDefinition(List<PartitionDefinitionElement> elements, List<ColumnEncodingDirective> encodings,
                               boolean template, int location) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        this.encodings = encodings == null ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(encodings));
        this.template = template;
        this.location = location;
    }

    public static PartitionDefinition of(List<PartitionDefinitionElement> elements) {
        return new PartitionDefinition(elements, null, false, PartitionValueExpr.UNKNOWN_LOCATION);
    }

    public static PartitionDefinition template(List<PartitionDefinitionElement> elements) {
        return new PartitionDefinition(elements, null, true, PartitionValueExpr.UNKNOWN_LOCATION);
    }

    public List<PartitionDefinitionElement> getElements() {
        return elements;
    }

    public List<ColumnEncodingDirective> getEncodings() {
        return encodings;
    }

    public boolean isTemplate() {
        return template;
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
        PartitionDefinition that = (PartitionDefinition) o;
        return template == that.template && location == that.location && Objects.equals(elements, that.elements)
            && Objects.equals(encodings, that.encodings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(elements, encodings, template, location);
    }

    @Override
    public String toString() {
        return (template ? "TEMPLATE " : "") + elements;
    }
}
