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
import com.alibaba.partgen.optimizer.partition.meta.ColumnMeta;

/**
 * Coerces START, END and VALUES literals to the partition key column: an explicit collation must
 * be the key's own, and the literal must be assignable to the column type.
 */
public class PartitionBoundValueTransformer {

    private PartitionBoundValueTransformer() {
    }

    /**
     * @return the value in the column type's representation, or {@code null} for the NULL literal
     */
    public static Object transform(ColumnMeta column, PartitionValueExpr expr) {
        checkCollation(column, expr);
        if (expr.isNull()) {
            return null;
        }
        Object value = column.getDataType().cast(expr.getValue(), column.getTypmod());
        if (value == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TYPE_MISMATCH, expr.getLocation(),
                String.format("specified value cannot be cast to type %s for column \"%s\"",
                    column.getDataType().getName(), column.getName()));
        }
        return value;
    }

    static void checkCollation(ColumnMeta column, PartitionValueExpr expr) {
        String collation = expr.getCollation();
        if (!CollationHandlers.isDefault(collation) && !collation.equals(column.getCollation())) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TYPE_MISMATCH, expr.getLocation(),
                String.format("collation of partition bound value for column \"%s\" does not match partition key "
                    + "collation \"%s\"", column.getName(), column.getCollation()));
        }
    }
}
