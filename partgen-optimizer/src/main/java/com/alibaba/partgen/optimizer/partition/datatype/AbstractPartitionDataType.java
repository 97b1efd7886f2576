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
import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.function.UnaryOperator;

public abstract class AbstractPartitionDataType implements PartitionDataType {

    protected final String name;

    protected AbstractPartitionDataType(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    @SuppressWarnings("unchecked")
    public int compare(Object value1, Object value2, CollationHandler collation) {
        return ((Comparable<Object>) value1).compareTo(value2);
    }

    /**
     * Name of the type a literal would be resolved to, used in "operator does not exist" messages.
     */
    public static String literalTypeName(Object value) {
        if (value == null) {
            return "unknown";
        } else if (value instanceof Short) {
            return "smallint";
        } else if (value instanceof Integer) {
            return "integer";
        } else if (value instanceof Long || value instanceof BigInteger) {
            return "bigint";
        } else if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
            return "numeric";
        } else if (value instanceof IntervalValue) {
            return "interval";
        } else if (value instanceof LocalDate) {
            return "date";
        } else if (value instanceof LocalDateTime) {
            return "timestamp without time zone";
        } else if (value instanceof OffsetDateTime) {
            return "timestamp with time zone";
        } else if (value instanceof String) {
            return "unknown";
        } else if (value instanceof Boolean) {
            return "boolean";
        }
        return value.getClass().getSimpleName();
    }

    protected static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger;
    }

    /**
     * Interval literal of a step, parsing an untyped string literal the way an unknown literal is
     * resolved against an interval operand.
     */
    protected static IntervalValue toInterval(Object step) {
        if (step instanceof IntervalValue) {
            return (IntervalValue) step;
        }
        if (step instanceof String) {
            return IntervalValue.tryParse((String) step);
        }
        return null;
    }

    /**
     * Wraps a temporal "+" so that a result outside the supported range is reported as
     * {@code <resultType> out of range} instead of a raw java.time error.
     */
    protected static UnaryOperator<Object> rangeChecked(String resultType, UnaryOperator<Object> operator) {
        return current -> {
            try {
                return operator.apply(current);
            } catch (DateTimeException | ArithmeticException e) {
                throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_ARITHMETIC, e, resultType + " out of range");
            }
        };
    }

    @Override
    public String toString() {
        return name;
    }
}
