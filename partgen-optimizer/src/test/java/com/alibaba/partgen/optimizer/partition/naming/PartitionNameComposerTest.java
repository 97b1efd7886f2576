package com.alibaba.partgen.optimizer.partition.naming;

import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

public class PartitionNameComposerTest {

    private PartitionNameComposer composer() {
        return new PartitionNameComposer(new DefaultRelationNameChooser(Collections.emptyList(), 63), "public",
            "sales", 1, "prt_", 63);
    }

    @Test
    public void testNamedPartitionsCount() {
        PartitionNameComposer composer = composer();
        Assert.assertEquals("1", composer.getLevelStr());
        Assert.assertEquals("sales_1_prt_other", composer.nextName("other"));
        Assert.assertEquals("sales_1_prt_2", composer.nextName(null));
        Assert.assertEquals("sales_1_prt_p1", composer.nextName("p1"));
        Assert.assertEquals(3, composer.getPartitionNumber());
    }

    @Test
    public void testTablenameOverride() {
        PartitionNameComposer composer = composer();
        composer.setTablename("legacy_name");
        Assert.assertEquals("legacy_name", composer.nextName(null));
        Assert.assertEquals("legacy_name", composer.nextName("p1"));
        Assert.assertEquals(0, composer.getPartitionNumber());
        composer.setTablename(null);
        Assert.assertEquals("sales_1_prt_1", composer.nextName(null));
    }

    @Test
    public void testTablenameSkipsChooser() {
        RelationNameChooser chooser = mock(RelationNameChooser.class);
        PartitionNameComposer composer = new PartitionNameComposer(chooser, "public", "sales", 1, "prt_", 63);
        composer.setTablename("t1");
        composer.nextName(null);
        verifyNoInteractions(chooser);
    }

    @Test
    public void testEveryName() {
        PartitionNameComposer composer = new PartitionNameComposer(
            new DefaultRelationNameChooser(Collections.emptyList(), 8), "public", "s", 1, "prt_", 8);
        Assert.assertEquals("p_3", composer.everyName("p", 3));
        Assert.assertEquals("abcdefgh", composer.everyName("abcdefghij", 12));
    }
}
