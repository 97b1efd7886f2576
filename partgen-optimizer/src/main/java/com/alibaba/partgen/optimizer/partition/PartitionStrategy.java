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

package com.alibaba.partgen.optimizer.partition;

/**
 * Partitioning strategy of one level of a partitioned relation. {@link #DEFAULT} only appears on
 * generated bounds, never as the strategy of a partition key.
 */
public enum PartitionStrategy {
    RANGE,
    LIST,
    DEFAULT;

    public static PartitionStrategy fromString(String strategy) {
        for (PartitionStrategy s : values()) {
            if (s.name().equalsIgnoreCase(strategy)) {
                return s;
            }
        }
        return null;
    }
}
