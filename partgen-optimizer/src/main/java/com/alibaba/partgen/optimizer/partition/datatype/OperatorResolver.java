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

import java.util.Comparator;
import java.util.function.UnaryOperator;

/**
 * Type and operator lookup for partition key columns.
 */
public interface OperatorResolver {

    /**
     * @throws com.alibaba.partgen.common.exception.PartGenRuntimeException if the type is unknown
     */
    PartitionDataType resolveType(String typeName);

    /**
     * @return the bound "+" operator, or {@code null} when the type has none for this step
     */
    UnaryOperator<Object> resolvePlusOperator(PartitionDataType type, Object step);

    Comparator<Object> resolveComparator(PartitionDataType type, String collation);
}
