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

package com.alibaba.partgen.optimizer.partition.template;

import com.alibaba.partgen.optimizer.partition.ast.PartitionDefinition;

/**
 * Sub-partition templates of partitioned tables, by root table and partition level, so that
 * partitions added later get the same sub-partitions as the ones created with the table.
 */
public interface PartitionTemplateStore {

    /**
     * Does nothing when a template is already stored for the relation and level.
     */
    void store(String relation, int level, PartitionDefinition definition);

    /**
     * @return the stored template, or {@code null}
     */
    PartitionDefinition get(String relation, int level);

    void removeByRelation(String relation);
}
