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

import java.util.HashMap;
import java.util.Map;

/**
 * This class contains all definitions of partition expansion params
 */
public class PartitionParams {

    public static final Map<String, ConfigParam> SUPPORTED_PARAMS = new HashMap<>();

    public static final StringConfigParam COLUMN_ORIENTED_ACCESS_METHODS = new StringConfigParam(
        PartitionProperties.COLUMN_ORIENTED_ACCESS_METHODS,
        "aoco",
        true,
        true);

    /**
     * NAMEDATALEN - 1 of the catalog the partitions are created in.
     */
    public static final IntConfigParam MAX_IDENTIFIER_LENGTH = new IntConfigParam(
        PartitionProperties.MAX_IDENTIFIER_LENGTH,
        1,
        1024,
        63,
        true);

    public static final StringConfigParam PARTITION_NAME_PREFIX = new StringConfigParam(
        PartitionProperties.PARTITION_NAME_PREFIX,
        "prt_",
        false,
        true);

    public static final IntConfigParam MAX_PARTITIONS_PER_ELEMENT = new IntConfigParam(
        PartitionProperties.MAX_PARTITIONS_PER_ELEMENT,
        0,
        Integer.MAX_VALUE,
        0,
        true);

    public static void addSupportedParam(ConfigParam param) {
        SUPPORTED_PARAMS.put(param.getName(), param);
    }
}
