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

import java.util.function.UnaryOperator;

/**
 * Capabilities a column type must offer to be used as a partition key: assignment casts of literals,
 * ordering, and the "+" operator used to step through START/END/EVERY ranges.
 */
public interface PartitionDataType {

    /**
     * Canonical type name, as it appears in error messages.
     */
    String getName();

    /**
     * Assignment cast of a literal to this type.
     *
     * @return the value in this type's representation, or {@code null} if the literal cannot be cast
     */
    Object cast(Object value, int typmod);

    int compare(Object value1, Object value2, CollationHandler collation);

    /**
     * Bind the "+" operator of this type to a step literal.
     *
     * @return {@code value -> value + step}, or {@code null} if no such operator exists
     */
    UnaryOperator<Object> plus(Object step);

    default boolean isCollatable() {
        return false;
    }
}
