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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.function.UnaryOperator;

/**
 * timestamp without time zone.
 */
public class TimestampDataType extends AbstractPartitionDataType {

    public static final TimestampDataType TIMESTAMP = new TimestampDataType();

    public TimestampDataType() {
        super("timestamp without time zone");
    }

    @Override
    public Object cast(Object value, int typmod) {
        if (value instanceof LocalDateTime) {
            return value;
        } else if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay();
        } else if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        } else if (value instanceof String) {
            TemporalAccessor parsed = TemporalLiterals.parse((String) value);
            return parsed == null ? null : TemporalLiterals.toLocalDateTime(parsed);
        }
        return null;
    }

    @Override
    public UnaryOperator<Object> plus(Object step) {
        IntervalValue interval = toInterval(step);
        if (interval == null) {
            return null;
        }
        return rangeChecked("timestamp", current -> interval.addTo((LocalDateTime) current));
    }
}
