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

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.function.UnaryOperator;

/**
 * smallint, integer and bigint. Values are held as {@link Long}; "+" fails instead of wrapping when
 * the result leaves the type's range.
 */
public class IntegerDataType extends AbstractPartitionDataType {

    public static final IntegerDataType SMALLINT = new IntegerDataType("smallint", Short.MIN_VALUE, Short.MAX_VALUE);
    public static final IntegerDataType INTEGER = new IntegerDataType("integer", Integer.MIN_VALUE, Integer.MAX_VALUE);
    public static final IntegerDataType BIGINT = new IntegerDataType("bigint", Long.MIN_VALUE, Long.MAX_VALUE);

    private final long minValue;
    private final long maxValue;

    public IntegerDataType(String name, long minValue, long maxValue) {
        super(name);
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    @Override
    public Object cast(Object value, int typmod) {
        BigInteger integral = toBigInteger(value);
        if (integral == null) {
            return null;
        }
        if (integral.compareTo(BigInteger.valueOf(minValue)) < 0
            || integral.compareTo(BigInteger.valueOf(maxValue)) > 0) {
            return null;
        }
        return integral.longValue();
    }

    private static BigInteger toBigInteger(Object value) {
        if (value instanceof BigInteger) {
            return (BigInteger) value;
        } else if (isIntegral(value)) {
            return BigInteger.valueOf(((Number) value).longValue());
        } else if (value instanceof BigDecimal) {
            return ((BigDecimal) value).setScale(0, RoundingMode.HALF_UP).toBigInteger();
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d).setScale(0, RoundingMode.HALF_EVEN).toBigInteger();
        } else if (value instanceof String) {
            String text = StringUtils.trim((String) value);
            try {
                return new BigInteger(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public UnaryOperator<Object> plus(Object step) {
        if (isIntegral(step) || (step instanceof String && toBigInteger(step) != null)) {
            BigInteger increment = toBigInteger(step);
            return current -> add((Long) current, increment);
        }
        if (step instanceof BigDecimal) {
            // integer + numeric yields numeric, cast back on assignment
            BigDecimal increment = (BigDecimal) step;
            return current -> BigDecimal.valueOf((Long) current).add(increment);
        }
        return null;
    }

    private Long add(long current, BigInteger increment) {
        BigInteger result = BigInteger.valueOf(current).add(increment);
        if (result.compareTo(BigInteger.valueOf(minValue)) < 0 || result.compareTo(BigInteger.valueOf(maxValue)) > 0) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_ARITHMETIC, name + " out of range");
        }
        return result.longValue();
    }

    public long getMinValue() {
        return minValue;
    }

    public long getMaxValue() {
        return maxValue;
    }
}
