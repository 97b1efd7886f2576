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

package com.alibaba.partgen.optimizer.partition.meta;

import com.alibaba.partgen.common.collation.CollationHandlers;
import com.alibaba.partgen.optimizer.partition.datatype.PartitionDataType;

/**
 * A resolved table column: its type, typmod (-1 when the type takes none) and collation.
 */
public class ColumnMeta {

    private final String name;
    private final PartitionDataType dataType;
    private final int typmod;
    private final String collation;

    public ColumnMeta(String name, PartitionDataType dataType) {
        this(name, dataType, -1, CollationHandlers.DEFAULT_COLLATION);
    }

    public ColumnMeta(String name, PartitionDataType dataType, int typmod, String collation) {
        this.name = name;
        this.dataType = dataType;
        this.typmod = typmod;
        this.collation = collation == null ? CollationHandlers.DEFAULT_COLLATION : collation;
    }

    public String getName() {
        return name;
    }

    public PartitionDataType getDataType() {
        return dataType;
    }

    public int getTypmod() {
        return typmod;
    }

    public String getCollation() {
        return collation;
    }

    @Override
    public String toString() {
        return name + " " + dataType.getName();
    }
}
