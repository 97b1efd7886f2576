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
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.function.UnaryOperator;

public class NumericDataType extends AbstractPartitionDataType {

    public static final NumericDataType NUMERIC = new NumericDataType();

    public NumericDataType() {
        super("numeric");
    }

    @Override
    public Object cast(Object value, int typmod) {
        return toBigDecimal(value);
    }

    private static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        } else if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        } else if (isIntegral(value)) {
            return BigDecimal.valueOf(((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            return Double.isNaN(d) || Double.isInfinite(d) ? null : BigDecimal.valueOf(d);
        } else if (value instanceof String) {
            try {
                return new BigDecimal(StringUtils.trim((String) value));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public int compare(Object value1, Object value2, CollationHandler collation) {
        // 1.0 and 1.00 are the same bound
        return ((BigDecimal) value1).compareTo((BigDecimal) value2);
    }

    @Override
    public UnaryOperator<Object> plus(Object step) {
        if (step instanceof IntervalValue) {
            return null;
        }
        BigDecimal increment = toBigDecimal(step);
        if (increment == null) {
            return null;
        }
        return current -> ((BigDecimal) current).add(increment);
    }
}
