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

import java.util.Objects;

/**
 * A literal in a partition bound or EVERY clause, optionally with an explicit COLLATE. A {@code null}
 * value is the NULL literal.
 */
public class PartitionValueExpr {

    public static final int UNKNOWN_LOCATION = -1;

    private final Object value;
    private final String collation;
    private final int location;

    public PartitionValueExpr(Object value, String collation, int location) {
        this.value = value;
        this.collation = collation;
        this.location = location;
    }

    public static PartitionValueExpr of(Object value) {
        return new PartitionValueExpr(value, null, UNKNOWN_LOCATION);
    }

    public static PartitionValueExpr nullValue() {
        return new PartitionValueExpr(null, null, UNKNOWN_LOCATION);
    }

    public PartitionValueExpr collate(String collation) {
        return new PartitionValueExpr(value, collation, location);
    }

    public PartitionValueExpr at(int location) {
        return new PartitionValueExpr(value, collation, location);
    }

    public boolean isNull() {
        return value == null;
    }

    public Object getValue() {
        return value;
    }

    public String getCollation() {
        return collation;
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
        PartitionValueExpr that = (PartitionValueExpr) o;
        return location == that.location && Objects.equals(value, that.value)
            && Objects.equals(collation, that.collation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, collation, location);
    }

    @Override
    public String toString() {
        String text = value == null ? "NULL" : value instanceof String ? "'" + value + "'" : String.valueOf(value);
        return collation == null ? text : text + " COLLATE " + collation;
    }
}
