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

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.common.properties.ParamManager;
import com.alibaba.partgen.common.properties.PartitionParams;
import com.alibaba.partgen.common.utils.Assert;
import com.alibaba.partgen.common.utils.GeneralUtil;
import com.alibaba.partgen.optimizer.partition.ast.ColumnEncodingDirective;
import com.alibaba.partgen.optimizer.partition.ast.ListPartitionBoundSpec;
import com.alibaba.partgen.optimizer.partition.ast.PartitionDefinition;
import com.alibaba.partgen.optimizer.partition.ast.PartitionDefinitionElement;
import com.alibaba.partgen.optimizer.partition.ast.PartitionSpec;
import com.alibaba.partgen.optimizer.partition.ast.PartitionValueExpr;
import com.alibaba.partgen.optimizer.partition.ast.RangePartitionBoundSpec;
import com.alibaba.partgen.optimizer.partition.bound.ImplicitRangeBoundResolver;
import com.alibaba.partgen.optimizer.partition.bound.PartEveryIterator;
import com.alibaba.partgen.optimizer.partition.bound.PartitionBound;
import com.alibaba.partgen.optimizer.partition.bound.PartitionBoundComparator;
import com.alibaba.partgen.optimizer.partition.datatype.OperatorResolver;
import com.alibaba.partgen.optimizer.partition.encoding.ColumnEncodingMerger;
import com.alibaba.partgen.optimizer.partition.expr.PartitionBoundValueTransformer;
import com.alibaba.partgen.optimizer.partition.expr.PlusExpressionCompiler;
import com.alibaba.partgen.optimizer.partition.meta.ColumnMeta;
import com.alibaba.partgen.optimizer.partition.meta.PartitionKey;
import com.alibaba.partgen.optimizer.partition.meta.PartitionedRelation;
import com.alibaba.partgen.optimizer.partition.naming.PartitionNameComposer;
import com.alibaba.partgen.optimizer.partition.naming.RelationNameChooser;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands a legacy partition definition ({@code PARTITION BY RANGE (c) (START (..) END (..) EVERY (..),
 * ...)} and friends) of one level into the explicit list of partitions to create under a parent.
 *
 * <p>Stateless between calls; one generator can serve any number of parents.
 */
public class PartitionGenerator {

    private static final Logger logger = LoggerFactory.getLogger(PartitionGenerator.class);

    public static final String TABLENAME_OPTION = "tablename";

    private final OperatorResolver operatorResolver;
    private final RelationNameChooser nameChooser;
    private final ParamManager paramManager;
    private final PlusExpressionCompiler plusExpressionCompiler;

    public PartitionGenerator(OperatorResolver operatorResolver, RelationNameChooser nameChooser,
                              ParamManager paramManager) {
        this.operatorResolver = operatorResolver;
        this.nameChooser = nameChooser;
        this.paramManager = paramManager;
        this.plusExpressionCompiler = new PlusExpressionCompiler(operatorResolver);
    }

    /**
     * @param parent the partitioned table the partitions are created under
     * @param definition the partition elements of this level
     * @param subSpec specification of the level below, or {@code null} if the partitions are leaves
     * @param inheritedOptions storage options of the parent, used by elements without their own
     * @param inheritedAccessMethod access method of the parent, used by elements without their own
     * @param inheritedEncoding column encodings of the parent table
     * @return the partitions in creation order; for RANGE sorted by bound, always with the default partition last
     */
    public List<GeneratedPartition> generatePartitions(PartitionedRelation parent, PartitionDefinition definition,
                                                       PartitionSpec subSpec, Map<String, Object> inheritedOptions,
                                                       String inheritedAccessMethod,
                                                       List<ColumnEncodingDirective> inheritedEncoding) {
        PartitionKey partitionKey = Assert.assertNotNull(parent.getPartitionKey(), "partition key of " + parent);

        Map<String, Object> parentOptions = withoutTablename(inheritedOptions);

        boolean subTemplate = false;
        if (subSpec != null && subSpec.getDefinition() != null) {
            Assert.assertTrue(subSpec.getDefinition().isTemplate(),
                "sub-partition definition at specification level must be a template");
            subTemplate = true;
        }

        // partition configuration level over parent table level
        List<ColumnEncodingDirective> configEncodings =
            ColumnEncodingMerger.merge(definition.getEncodings(), inheritedEncoding, definition.getLocation());

        List<PartitionDefinitionElement> elements = defaultFirst(definition.getElements());

        PartitionNameComposer nameComposer = new PartitionNameComposer(nameChooser, parent.getSchemaName(),
            parent.getName(), parent.getLevel() + 1,
            paramManager.getString(PartitionParams.PARTITION_NAME_PREFIX),
            paramManager.getInt(PartitionParams.MAX_IDENTIFIER_LENGTH));
        Set<String> columnOrientedMethods = paramManager.getStringSet(PartitionParams.COLUMN_ORIENTED_ACCESS_METHODS);

        List<GeneratedPartition> result = new ArrayList<>();
        Map<GeneratedPartition, Integer> locations = new IdentityHashMap<>();
        for (PartitionDefinitionElement element : elements) {
            PartitionSpec elementSubSpec = null;
            if (subSpec != null) {
                PartitionDefinition subDefinition =
                    subTemplate ? subSpec.getDefinition() : element.getSubDefinition();
                if (subDefinition == null) {
                    throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, subSpec.getLocation(),
                        "no partitions specified at depth " + (parent.getLevel() + 2));
                }
                elementSubSpec = new PartitionSpec(subSpec.getStrategy(), subSpec.getKeyColumns(), subDefinition,
                    subSpec.getSubSpec(), subSpec.getLocation());
            }

            nameComposer.setTablename(extractTablename(element.getOptions()));
            Map<String, Object> elementOptions = withoutTablename(element.getOptions());

            ElementContext context = new ElementContext();
            context.element = element;
            context.subSpec = elementSubSpec;
            context.options = elementOptions.isEmpty() ? parentOptions : elementOptions;
            context.accessMethod = GeneralUtil.coalesce(element.getAccessMethod(), inheritedAccessMethod);
            context.tablespace = GeneralUtil.coalesce(element.getTablespace(), parent.getTablespace());
            if (context.accessMethod != null && columnOrientedMethods.contains(context.accessMethod)) {
                context.encodings =
                    ColumnEncodingMerger.merge(element.getColumnEncodings(), configEncodings, element.getLocation());
            } else {
                context.encodings = element.getColumnEncodings();
            }

            List<GeneratedPartition> newParts;
            try {
                newParts = generateElement(parent, partitionKey, context, nameComposer);
            } catch (PartGenRuntimeException e) {
                throw e.atPosition(element.getLocation());
            }
            if (logger.isDebugEnabled()) {
                for (GeneratedPartition partition : newParts) {
                    logger.debug("Generated partition " + partition.getName() + " of " + parent + ": "
                        + partition.getBound());
                }
            }
            for (GeneratedPartition partition : newParts) {
                result.add(partition);
                locations.put(partition, element.getLocation());
            }
        }

        if (partitionKey.getStrategy() == PartitionStrategy.RANGE) {
            result = new ImplicitRangeBoundResolver(new PartitionBoundComparator(partitionKey))
                .resolve(result, locations::get);
        } else {
            result = defaultLast(result);
        }

        logger.info("Generated " + result.size() + " partition(s) at level " + (parent.getLevel() + 1) + " of "
            + parent + " from " + definition.getElements().size() + " element(s)");
        return result;
    }

    private List<GeneratedPartition> generateElement(PartitionedRelation parent, PartitionKey partitionKey,
                                                     ElementContext context, PartitionNameComposer nameComposer) {
        if (context.element.isDefault()) {
            return generateDefaultPartition(parent, context, nameComposer);
        }
        switch (partitionKey.getStrategy()) {
        case RANGE:
            return generateRangePartitions(parent, context, nameComposer);
        case LIST:
            return ImmutableList.of(generateListPartition(parent, context, nameComposer));
        default:
            throw new PartGenRuntimeException(ErrorCode.ERR_NOT_SUPPORT,
                "partition strategy " + partitionKey.getStrategy());
        }
    }

    /**
     * The default element moves to the front so that it takes partition number 1, as the legacy
     * numbering does wherever it is written.
     */
    private static List<PartitionDefinitionElement> defaultFirst(List<PartitionDefinitionElement> elements) {
        PartitionDefinitionElement defaultElement = null;
        List<PartitionDefinitionElement> others = new ArrayList<>(elements.size());
        for (PartitionDefinitionElement element : elements) {
            if (element.isDefault()) {
                if (defaultElement != null) {
                    throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_DUPLICATE_DEFAULT,
                        element.getLocation(), "multiple default partitions are not allowed");
                }
                defaultElement = element;
            } else {
                others.add(element);
            }
        }
        if (defaultElement == null) {
            return others;
        }
        return ImmutableList.<PartitionDefinitionElement>builder().add(defaultElement).addAll(others).build();
    }

    /**
     * Moves the default partition behind the others, keeping its name and the order of the rest.
     */
    private static List<GeneratedPartition> defaultLast(List<GeneratedPartition> partitions) {
        List<GeneratedPartition> result = new ArrayList<>(partitions.size());
        GeneratedPartition defaultPartition = null;
        for (GeneratedPartition partition : partitions) {
            if (partition.getBound().isDefault()) {
                defaultPartition = partition;
            } else {
                result.add(partition);
            }
        }
        if (defaultPartition != null) {
            result.add(defaultPartition);
        }
        return result;
    }

    static String extractTablename(Map<String, Object> options) {
        if (options == null || !options.containsKey(TABLENAME_OPTION)) {
            return null;
        }
        Object tablename = options.get(TABLENAME_OPTION);
        if (!(tablename instanceof String)) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, "invalid tablename specification");
        }
        return (String) tablename;
    }

    static Map<String, Object> withoutTablename(Map<String, Object> options) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (options == null) {
            return result;
        }
        extractTablename(options);
        for (Map.Entry<String, Object> entry : options.entrySet()) {
            if (!TABLENAME_OPTION.equals(entry.getKey())) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    private List<GeneratedPartition> generateDefaultPartition(PartitionedRelation parent, ElementContext context,
                                                              PartitionNameComposer nameComposer) {
        PartitionDefinitionElement element = context.element;
        if (element.getName() == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, element.getLocation(),
                "default partition must have a name");
        }
        String name = nameComposer.nextName(element.getName());
        return ImmutableList.of(context.toPartition(parent, name, PartitionBound.defaultBound()));
    }

    private List<GeneratedPartition> generateRangePartitions(PartitionedRelation parent, ElementContext context,
                                                             PartitionNameComposer nameComposer) {
        PartitionDefinitionElement element = context.element;
        if (element.getBoundSpec() == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, element.getLocation(),
                String.format("missing boundary specification in partition \"%s\" of type RANGE", element.getName()));
        }
        if (!(element.getBoundSpec() instanceof RangePartitionBoundSpec)) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, element.getLocation(),
                "invalid boundary specification for RANGE partition");
        }
        RangePartitionBoundSpec boundSpec = (RangePartitionBoundSpec) element.getBoundSpec();
        PartitionKey partitionKey = parent.getPartitionKey();
        if (partitionKey.getColumnCount() != 1) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, element.getLocation(),
                "too many columns for RANGE partition -- only one column is allowed");
        }

        PartitionValueExpr start = singleValue(boundSpec.getStart(), "start", element);
        PartitionValueExpr end = singleValue(boundSpec.getEnd(), "end", element);
        PartitionValueExpr every = null;
        // a legacy tablename names exactly one partition, so EVERY is ignored
        if (nameComposer.getTablename() == null) {
            every = singleValue(boundSpec.getEvery(), "every", element);
        }

        List<GeneratedPartition> result = new ArrayList<>();
        try (PartEveryIterator iterator = new PartEveryIterator(partitionKey, plusExpressionCompiler, start, end,
            boundSpec.isEndInclusive(), every, paramManager.getInt(PartitionParams.MAX_PARTITIONS_PER_ELEMENT))) {
            int i = 0;
            while (iterator.hasNext()) {
                PartitionBound bound = iterator.next();
                String partName = element.getName();
                if (every != null && partName != null) {
                    partName = nameComposer.everyName(partName, ++i);
                }
                result.add(context.toPartition(parent, nameComposer.nextName(partName), bound));
            }
        }
        return result;
    }

    private static PartitionValueExpr singleValue(List<PartitionValueExpr> values, String clause,
                                                  PartitionDefinitionElement element) {
        if (values == null) {
            return null;
        }
        if (values.size() != 1) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, element.getLocation(),
                "invalid number of " + clause + " values");
        }
        return values.get(0);
    }

    private GeneratedPartition generateListPartition(PartitionedRelation parent, ElementContext context,
                                                     PartitionNameComposer nameComposer) {
        PartitionDefinitionElement element = context.element;
        if (element.getBoundSpec() == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, element.getLocation(),
                String.format("missing boundary specification in partition \"%s\" of type LIST", element.getName()));
        }
        if (!(element.getBoundSpec() instanceof ListPartitionBoundSpec)) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, element.getLocation(),
                "invalid boundary specification for LIST partition");
        }
        ListPartitionBoundSpec boundSpec = (ListPartitionBoundSpec) element.getBoundSpec();
        PartitionKey partitionKey = parent.getPartitionKey();
        ColumnMeta column = partitionKey.getColumn(0);

        List<Object> values = new ArrayList<>();
        boolean hasNull = false;
        for (List<PartitionValueExpr> tuple : boundSpec.getValues()) {
            if (tuple.size() != 1) {
                throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, element.getLocation(),
                    "VALUES specification with more than one column not allowed");
            }
            Object value = PartitionBoundValueTransformer.transform(column, tuple.get(0));
            if (value == null) {
                if (!hasNull) {
                    values.add(null);
                    hasNull = true;
                }
            } else if (!containsValue(partitionKey, values, value)) {
                values.add(value);
            }
        }
        return context.toPartition(parent, nameComposer.nextName(element.getName()), PartitionBound.list(values));
    }

    private static boolean containsValue(PartitionKey partitionKey, List<Object> values, Object value) {
        for (Object existing : values) {
            if (existing != null && partitionKey.compare(0, existing, value) == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * What one element resolved to before its bounds are expanded.
     */
    private static class ElementContext {
        PartitionDefinitionElement element;
        PartitionSpec subSpec;
        Map<String, Object> options;
        String accessMethod;
        String tablespace;
        List<ColumnEncodingDirective> encodings;

        GeneratedPartition toPartition(PartitionedRelation parent, String name, PartitionBound bound) {
            return new GeneratedPartition(parent.getSchemaName(), name, parent.getName(), bound, options,
                accessMethod, tablespace, encodings, subSpec);
        }
    }
}
