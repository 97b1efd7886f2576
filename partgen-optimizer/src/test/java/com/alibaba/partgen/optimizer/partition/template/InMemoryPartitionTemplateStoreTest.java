package com.alibaba.partgen.optimizer.partition.template;

import com.alibaba.partgen.optimizer.partition.ast.PartitionDefinition;
import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import static com.alibaba.partgen.optimizer.partition.PartitionTestUtil.list;
import static com.alibaba.partgen.optimizer.partition.PartitionTestUtil.range;

public class InMemoryPartitionTemplateStoreTest {

    private final PartitionDefinition regions = PartitionDefinition.template(ImmutableList.of(list("usa", "usa")));
    private final PartitionDefinition months = PartitionDefinition.template(ImmutableList.of(range(null, 1, 13, 1)));

    @Test
    public void testStoreAndGet() {
        InMemoryPartitionTemplateStore store = new InMemoryPartitionTemplateStore();
        Assert.assertNull(store.get("sales", 2));
        store.store("sales", 2, regions);
        store.store("sales", 3, months);
        Assert.assertEquals(regions, store.get("sales", 2));
        Assert.assertEquals(months, store.get("sales", 3));
        Assert.assertNull(store.get("orders", 2));
    }

    @Test
    public void testStoreKeepsFirst() {
        InMemoryPartitionTemplateStore store = new InMemoryPartitionTemplateStore();
        store.store("sales", 2, regions);
        String text = store.getText("sales", 2);
        store.store("sales", 2, months);
        Assert.assertEquals(text, store.getText("sales", 2));
        Assert.assertEquals(regions, store.get("sales", 2));
    }

    @Test
    public void testRemoveByRelation() {
        InMemoryPartitionTemplateStore store = new InMemoryPartitionTemplateStore();
        store.store("sales", 2, regions);
        store.store("sales", 3, months);
        store.store("orders", 2, regions);
        store.removeByRelation("sales");
        Assert.assertNull(store.get("sales", 2));
        Assert.assertNull(store.get("sales", 3));
        Assert.assertEquals(regions, store.get("orders", 2));
        // nothing to remove
        store.removeByRelation("sales");
    }
}
