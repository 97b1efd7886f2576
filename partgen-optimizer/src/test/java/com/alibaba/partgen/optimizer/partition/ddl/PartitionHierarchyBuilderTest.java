package com.alibaba.partgen.optimizer.partition.ddl;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.common.properties.ParamManager;
import com.alibaba.partgen.optimizer.partition.GeneratedPartition;
import com.alibaba.partgen.optimizer.partition.PartitionGenerator;
import com.alibaba.partgen.optimizer.partition.PartitionStrategy;
import com.alibaba.partgen.optimizer.partition.ast.PartitionDefinition;
import com.alibaba.partgen.optimizer.partition.ast.PartitionSpec;
import com.alibaba.partgen.optimizer.partition.datatype.DataTypeRegistry;
import com.alibaba.partgen.optimizer.partition.meta.PartitionedRelation;
import com.alibaba.partgen.optimizer.partition.naming.DefaultRelationNameChooser;
import com.alibaba.partgen.optimizer.partition.template.InMemoryPartitionTemplateStore;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static com.alibaba.partgen.optimizer.partition.PartitionTestUtil.defaultPartition;
import static com.alibaba.partgen.optimizer.partition.PartitionTestUtil.list;
import static com.alibaba.partgen.optimizer.partition.PartitionTestUtil.range;
import static com.alibaba.partgen.optimizer.partition.PartitionTestUtil.relation;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class PartitionHierarchyBuilderTest {

    private PartitionTableCreator tableCreator;
    private InMemoryPartitionTemplateStore templateStore;
    private PartitionHierarchyBuilder builder;
    private PartitionedRelation sales;

    @Before
    public void setUp() {
        tableCreator = mock(PartitionTableCreator.class);
        templateStore = new InMemoryPartitionTemplateStore();
        PartitionGenerator generator = new PartitionGenerator(DataTypeRegistry.getInstance(),
            new DefaultRelationNameChooser(Collections.emptyList(), 63), ParamManager.getDefault());
        builder = new PartitionHierarchyBuilder(generator, tableCreator, templateStore,
            DataTypeRegistry.getInstance());
        sales = relation("sales", PartitionStrategy.RANGE)
            .options(ImmutableMap.of("appendonly", true))
            .accessMethod("ao_row")
            .build();
    }

    private static PartitionSpec rangeSpec(PartitionDefinition definition, PartitionSpec subSpec) {
        return new PartitionSpec(PartitionStrategy.RANGE, ImmutableList.of("j"), definition, subSpec, 1);
    }

    private static PartitionSpec regionSpec(List<String> keyColumns) {
        PartitionDefinition regions = PartitionDefinition.template(ImmutableList.of(list("a", 1), list("b", 2)));
        return new PartitionSpec(PartitionStrategy.LIST, keyColumns, regions, null, 30);
    }

    @Test
    public void testDepthFirstCreation() {
        PartitionSpec spec = rangeSpec(PartitionDefinition.of(ImmutableList.of(range("p", 1, 3, 1))),
            regionSpec(ImmutableList.of("k")));

        List<GeneratedPartition> created = builder.build(sales, spec);

        Assert.assertEquals(ImmutableList.of("sales_1_prt_p_1", "sales_1_prt_p_1_2_prt_a", "sales_1_prt_p_1_2_prt_b",
                "sales_1_prt_p_2", "sales_1_prt_p_2_2_prt_a", "sales_1_prt_p_2_2_prt_b"),
            created.stream().map(GeneratedPartition::getName).collect(Collectors.toList()));

        InOrder order = inOrder(tableCreator);
        order.verify(tableCreator).createPartition(argThat(parent -> "sales".equals(parent.getName())),
            argThat(partition -> "sales_1_prt_p_1".equals(partition.getName())));
        order.verify(tableCreator).createPartition(argThat(parent -> "sales_1_prt_p_1".equals(parent.getName())),
            argThat(partition -> "sales_1_prt_p_1_2_prt_a".equals(partition.getName())));
        order.verify(tableCreator).createPartition(argThat(parent -> "sales".equals(parent.getName())),
            argThat(partition -> "sales_1_prt_p_2".equals(partition.getName())));
        verify(tableCreator, times(6)).createPartition(any(), any());
    }

    @Test
    public void testChildRelation() {
        PartitionSpec spec = rangeSpec(PartitionDefinition.of(ImmutableList.of(range("p", 1, 2))),
            regionSpec(ImmutableList.of("K")));
        builder.build(sales, spec);

        ArgumentCaptor<PartitionedRelation> parents = ArgumentCaptor.forClass(PartitionedRelation.class);
        ArgumentCaptor<GeneratedPartition> partitions = ArgumentCaptor.forClass(GeneratedPartition.class);
        verify(tableCreator, times(3)).createPartition(parents.capture(), partitions.capture());

        PartitionedRelation child = parents.getAllValues().get(1);
        Assert.assertEquals("sales_1_prt_p", child.getName());
        Assert.assertEquals(1, child.getLevel());
        Assert.assertEquals(PartitionStrategy.LIST, child.getPartitionKey().getStrategy());
        Assert.assertEquals("k", child.getPartitionKey().getColumn(0).getName());
        Assert.assertEquals("ao_row", child.getAccessMethod());

        GeneratedPartition leaf = partitions.getAllValues().get(1);
        Assert.assertEquals(ImmutableMap.of("appendonly", true), leaf.getOptions());
        Assert.assertEquals("ao_row", leaf.getAccessMethod());
        Assert.assertNull(leaf.getSubPartitionSpec());
    }

    @Test
    public void testTemplateStored() {
        PartitionSpec subSpec = regionSpec(ImmutableList.of("k"));
        builder.build(sales, rangeSpec(PartitionDefinition.of(ImmutableList.of(range("p", 1, 2))), subSpec));
        Assert.assertEquals(subSpec.getDefinition(), templateStore.get("sales", 2));
        Assert.assertNull(templateStore.get("sales", 1));
    }

    @Test
    public void testMissingKeyColumn() {
        PartitionSpec spec = rangeSpec(PartitionDefinition.of(ImmutableList.of(range("p", 1, 2))),
            regionSpec(ImmutableList.of("region")));
        try {
            builder.build(sales, spec);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_INVALID_SPEC, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("column \"region\" named in partition key does not exist"));
        }
    }

    @Test
    public void testNoDefinition() {
        try {
            builder.build(sales, rangeSpec(null, null));
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_INVALID_SPEC, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("no partitions specified at depth 1"));
        }
        verifyNoInteractions(tableCreator);
    }

    @Test
    public void testNothingCreatedOnInvalidLevel() {
        PartitionSpec spec = rangeSpec(
            PartitionDefinition.of(ImmutableList.of(defaultPartition("d1"), range("p", 1, 2), defaultPartition("d2"))),
            null);
        try {
            builder.build(sales, spec);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_DUPLICATE_DEFAULT, e.getErrorCodeType());
        }
        verifyNoInteractions(tableCreator);
    }
}
