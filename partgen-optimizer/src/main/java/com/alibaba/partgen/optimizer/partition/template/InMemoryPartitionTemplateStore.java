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
import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Template store keeping the serialized definitions in memory.
 */
public class InMemoryPartitionTemplateStore implements PartitionTemplateStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPartitionTemplateStore.class);

    private final Table<String, Integer, String> templates = HashBasedTable.create();

    private final PartitionDefinitionJsonCodec codec;

    public InMemoryPartitionTemplateStore() {
        this(new PartitionDefinitionJsonCodec());
    }

    public InMemoryPartitionTemplateStore(PartitionDefinitionJsonCodec codec) {
        this.codec = codec;
    }

    @Override
    public synchronized void store(String relation, int level, PartitionDefinition definition) {
        if (templates.contains(relation, level)) {
            return;
        }
        templates.put(relation, level, codec.encode(definition));
        logger.info("Stored partition template of " + relation + " at level " + level);
    }

    @Override
    public synchronized PartitionDefinition get(String relation, int level) {
        String text = templates.get(relation, level);
        return text == null ? null : codec.decode(text);
    }

    @Override
    public synchronized void removeByRelation(String relation) {
        Map<Integer, String> row = templates.row(relation);
        if (!row.isEmpty()) {
            logger.info("Removed " + row.size() + " partition template(s) of " + relation);
            row.clear();
        }
    }

    synchronized String getText(String relation, int level) {
        return templates.get(relation, level);
    }
}
