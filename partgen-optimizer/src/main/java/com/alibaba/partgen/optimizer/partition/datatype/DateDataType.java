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

import org.apache.commons.lang3.StringUtils;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.function.UnaryOperator;

/**
 * date. "+" accepts a number of days, giving a date, or an interval, giving a timestamp that is
 * truncated back to a date on assignment.
 */
public class DateDataType extends AbstractPartitionDataType {

    public static final DateDataType DATE = new DateDataType();

    public DateDataType() {
        super("date");
    }

    @Override
    public Object cast(Object value, int typmod) {
        if (value instanceof LocalDate) {
            return value;
        } else if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        } else if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDate();
        } else if (value instanceof String) {
            TemporalAccessor parsed = TemporalLiterals.parse((String) value);
            return parsed == null ? null : TemporalLiterals.toLocalDate(parsed);
        }
        return null;
    }

    @Override
    public UnaryOperator<Object> plus(Object step) {
        Long days = toDays(step);
        if (days != null) {
            return rangeChecked("date", current -> ((LocalDate) current).plusDays(days));
        }
        IntervalValue interval = toInterval(step);
        if (interval != null) {
            return rangeChecked("timestamp", current -> interval.addTo(((LocalDate) current).atStartOfDay()));
        }
        return null;
    }

    private static Long toDays(Object step) {
        if (isIntegral(step)) {
            return ((Number) step).longValue();
        }
        if (step instanceof String) {
            String text = StringUtils.trim((String) step);
            try {
                return new BigInteger(text).longValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                return null;
            }
        }
        return null;
    }
}
