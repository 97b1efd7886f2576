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

package com.alibaba.partgen.optimizer.partition.expr;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.optimizer.partition.meta.ColumnMeta;

import java.util.function.UnaryOperator;

/**
 * Compiled {@code $1 + step} for one partition key column, assignment-cast back to the column type.
 * The current value is fed through parameter slot 0 on every call.
 */
public class PlusExpression implements AutoCloseable {

    private final ColumnMeta column;
    private final UnaryOperator<Object> operator;
    private final ExprEvaluationContext context;
    private final int location;

    PlusExpression(ColumnMeta column, UnaryOperator<Object> operator, int location) {
        this.column = column;
        this.operator = operator;
        this.context = new ExprEvaluationContext(1);
        this.location = location;
    }

    public Object evaluate(Object current) {
        context.setParam(0, current);
        Object result;
        try {
            result = operator.apply(context.getParam(0));
        } catch (PartGenRuntimeException e) {
            // overflow inside the operator is reported at the step
            throw e.atPosition(location);
        }
        context.onEvaluated();
        if (result == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_ASSERT_FAIL, "plus-operator returned NULL");
        }
        Object casted = column.getDataType().cast(result, column.getTypmod());
        if (casted == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TYPE_MISMATCH, location,
                String.format("specified value cannot be cast to type %s for column \"%s\"",
                    column.getDataType().getName(), column.getName()));
        }
        return casted;
    }

    public ExprEvaluationContext getContext() {
        return context;
    }

    public int getLocation() {
        return location;
    }

    @Override
    public void close() {
        context.close();
    }
}
