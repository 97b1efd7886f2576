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

import com.alibaba.partgen.common.collation.CollationHandlers;
import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.optimizer.partition.ast.PartitionValueExpr;
import com.alibaba.partgen.optimizer.partition.datatype.AbstractPartitionDataType;
import com.alibaba.partgen.optimizer.partition.datatype.OperatorResolver;
import com.alibaba.partgen.optimizer.partition.meta.ColumnMeta;

import java.util.function.UnaryOperator;

/**
 * Builds {@link PlusExpression}s: the step is not cast to the column type but passed to the
 * column type's "+" operator as is, so a timestamp column can step by an interval.
 */
public class PlusExpressionCompiler {

    private final OperatorResolver operatorResolver;

    public PlusExpressionCompiler(OperatorResolver operatorResolver) {
        this.operatorResolver = operatorResolver;
    }

    public PlusExpression compile(ColumnMeta column, PartitionValueExpr step) {
        PartitionBoundValueTransformer.checkCollation(column, step);

        UnaryOperator<Object> operator;
        if (step.isNull()) {
            // "+" is strict
            operator = current -> null;
        } else {
            operator = operatorResolver.resolvePlusOperator(column.getDataType(), step.getValue());
            if (operator == null) {
                throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TYPE_MISMATCH, step.getLocation(),
                    String.format("operator does not exist: %s + %s", column.getDataType().getName(),
                        AbstractPartitionDataType.literalTypeName(step.getValue())));
            }
        }
        return new PlusExpression(column, operator, step.getLocation());
    }

    /**
     * Turn an inclusive END into the exclusive bound {@code end + 1}. The unit is the integer literal
     * 1 whatever the column type, which covers integer and date keys.
     */
    public Object canonicalizeRangeEnd(ColumnMeta column, Object endValue, boolean endInclusive) {
        if (!endInclusive) {
            return endValue;
        }
        try (PlusExpression plusOne = compile(column,
            new PartitionValueExpr(1, CollationHandlers.DEFAULT_COLLATION, PartitionValueExpr.UNKNOWN_LOCATION))) {
            return plusOne.evaluate(endValue);
        }
    }
}
