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

import com.alibaba.partgen.common.utils.Assert;
import com.alibaba.partgen.optimizer.partition.meta.PartitionKey;

import java.util.Objects;

/**
 * One column of a RANGE bound: a value of the key column's type, or the MINVALUE / MAXVALUE marker
 * that orders before / after every value.
 */
public final class RangeDatum {

    public enum Kind {
        MINVALUE,
        VALUE,
        MAXVALUE
    }

    private static final RangeDatum MIN = new RangeDatum(Kind.MINVALUE, null);
    private static final RangeDatum MAX = new RangeDatum(Kind.MAXVALUE, null);

    private final Kind kind;
    private final Object value;

    private RangeDatum(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static RangeDatum minValue() {
        return MIN;
    }

    public static RangeDatum maxValue() {
        return MAX;
    }

    public static RangeDatum of(Object value) {
        Assert.assertNotNull(value, "range bound value");
        return new RangeDatum(Kind.VALUE, value);
    }

    public static int compare(PartitionKey key, int columnIndex, RangeDatum datum1, RangeDatum datum2) {
        if (datum1.kind != Kind.VALUE || datum2.kind != Kind.VALUE) {
            return Integer.compare(datum1.kind.ordinal(), datum2.kind.ordinal());
        }
        return key.compare(columnIndex, datum1.value, datum2.value);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isValue() {
        return kind == Kind.VALUE;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RangeDatum that = (RangeDatum) o;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        if (kind != Kind.VALUE) {
            return kind.name();
        }
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
