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

package com.alibaba.partgen.common.properties;

/**
 * Names of the parameters accepted by the partition expansion.
 */
public class PartitionProperties {

    /**
     * Comma separated access methods whose partitions get the merged column encoding clauses.
     */
    public static final String COLUMN_ORIENTED_ACCESS_METHODS = "COLUMN_ORIENTED_ACCESS_METHODS";

    /**
     * Longest relation name the naming collaborator may produce.
     */
    public static final String MAX_IDENTIFIER_LENGTH = "MAX_IDENTIFIER_LENGTH";

    public static final String PARTITION_NAME_PREFIX = "PARTITION_NAME_PREFIX";

    /**
     * Upper limit of partitions a single START/END/EVERY element may expand to, 0 means no limit.
     */
    public static final String MAX_PARTITIONS_PER_ELEMENT = "MAX_PARTITIONS_PER_ELEMENT";
}
