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

package com.alibaba.partgen.optimizer.partition.datatype;

import com.alibaba.partgen.common.collation.CollationHandler;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAccessor;
import java.util.function.UnaryOperator;

/**
 * timestamp with time zone. Values are ordered by instant, whatever their offsets.
 */
public class TimestampTzDataType extends AbstractPartitionDataType {

    public static final TimestampTzDataType TIMESTAMPTZ = new TimestampTzDataType();

    public TimestampTzDataType() {
        super("timestamp with time zone");
    }

    @Override
    public Object cast(Object value, int typmod) {
        if (value instanceof OffsetDateTime) {
            return value;
        } else if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atOffset(ZoneOffset.UTC);
        } else if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay().atOffset(ZoneOffset.UTC);
        } else if (value instanceof String) {
            TemporalAccessor parsed = TemporalLiterals.parse((String) value);
            return parsed == null ? null : TemporalLiterals.toOffsetDateTime(parsed);
        }
        return null;
    }

    @Override
    public int compare(Object value1, Object value2, CollationHandler collation) {
        return OffsetDateTime.timeLineOrder().compare((OffsetDateTime) value1, (OffsetDateTime) value2);
    }

    @Override
    public UnaryOperator<Object> plus(Object step) {
        IntervalValue interval = toInterval(step);
        if (interval == null) {
            return null;
        }
        return rangeChecked("timestamp with time zone", current -> interval.addTo((OffsetDateTime) current));
    }
}
