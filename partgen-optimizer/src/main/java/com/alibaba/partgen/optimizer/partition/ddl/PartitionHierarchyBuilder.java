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

package com.alibaba.partgen.optimizer.partition.ddl;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.optimizer.partition.GeneratedPartition;
import com.alibaba.partgen.optimizer.partition.PartitionGenerator;
import com.alibaba.partgen.optimizer.partition.ast.ColumnEncodingDirective;
import com.alibaba.partgen.optimizer.partition.ast.PartitionDefinition;
import com.alibaba.partgen.optimizer.partition.ast.PartitionSpec;
import com.alibaba.partgen.optimizer.partition.datatype.OperatorResolver;
import com.alibaba.partgen.optimizer.partition.meta.ColumnMeta;
import com.alibaba.partgen.optimizer.partition.meta.PartitionKey;
import com.alibaba.partgen.optimizer.partition.meta.PartitionedRelation;
import com.alibaba.partgen.optimizer.partition.template.PartitionTemplateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Creates a whole legacy partition hierarchy: the partitions of the root, and below each of them its
 * sub-partitions, depth first. Every child is handed to the {@link PartitionTableCreator} before its
 * own partitions.
 */
public class PartitionHierarchyBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PartitionHierarchyBuilder.class);

    private final PartitionGenerator generator;
    private final PartitionTableCreator tableCreator;
    private final PartitionTemplateStore templateStore;
    private final OperatorResolver operatorResolver;

    public PartitionHierarchyBuilder(PartitionGenerator generator, PartitionTableCreator tableCreator,
                                     PartitionTemplateStore templateStore, OperatorResolver operatorResolver) {
        this.generator = generator;
        this.tableCreator = tableCreator;
        this.templateStore = templateStore;
        this.operatorResolver = operatorResolver;
    }

    /**
     * @param root the partitioned table, with the partition key of {@code rootSpec} resolved
     * @return every created partition, parents before their children
     */
    public List<GeneratedPartition> build(PartitionedRelation root, PartitionSpec rootSpec) {
        List<GeneratedPartition> created = new ArrayList<>();
        buildLevel(root, root, rootSpec, root.getOptions(), root.getAccessMethod(), root.getColumnEncodings(),
            created);
        logger.info("Created " + created.size() + " partition(s) under " + root);
        return created;
    }

    private void buildLevel(PartitionedRelation root, PartitionedRelation parent, PartitionSpec spec,
                            Map<String, Object> options, String accessMethod,
                            List<ColumnEncodingDirective> encodings, List<GeneratedPartition> created) {
        PartitionDefinition definition = spec.getDefinition();
        if (definition == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, spec.getLocation(),
                "no partitions specified at depth " + (parent.getLevel() + 1));
        }
        PartitionSpec subSpec = spec.getSubSpec();
        if (subSpec != null && subSpec.getDefinition() != null && subSpec.getDefinition().isTemplate()) {
            templateStore.store(root.getName(), parent.getLevel() + 2, subSpec.getDefinition());
        }

        List<GeneratedPartition> children =
            generator.generatePartitions(parent, definition, subSpec, options, accessMethod, encodings);
        for (GeneratedPartition child : children) {
            tableCreator.createPartition(parent, child);
            created.add(child);
            if (child.getSubPartitionSpec() != null) {
                PartitionSpec childSpec = child.getSubPartitionSpec();
                PartitionedRelation childRelation = PartitionedRelation.builder(child.getSchemaName(), child.getName())
                    .columns(parent.getColumns())
                    .partitionKey(resolvePartitionKey(parent, childSpec))
                    .level(parent.getLevel() + 1)
                    .options(child.getOptions())
                    .accessMethod(child.getAccessMethod())
                    .tablespace(child.getTablespace())
                    .columnEncodings(child.getColumnEncodings())
                    .build();
                buildLevel(root, childRelation, childSpec, child.getOptions(), child.getAccessMethod(),
                    child.getColumnEncodings(), created);
            }
        }
    }

    private PartitionKey resolvePartitionKey(PartitionedRelation parent, PartitionSpec spec) {
        List<ColumnMeta> keyColumns = new ArrayList<>(spec.getKeyColumns().size());
        for (String columnName : spec.getKeyColumns()) {
            ColumnMeta column = parent.getColumn(columnName);
            if (column == null) {
                throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, spec.getLocation(),
                    "column \"" + columnName + "\" named in partition key does not exist");
            }
            keyColumns.add(column);
        }
        return new PartitionKey(spec.getStrategy(), keyColumns, operatorResolver);
    }
}
