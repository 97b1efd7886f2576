package com.alibaba.partgen.optimizer.partition.bound;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.optimizer.partition.GeneratedPartition;
import com.alibaba.partgen.optimizer.partition.PartitionStrategy;
import com.alibaba.partgen.optimizer.partition.PartitionTestUtil;
import com.google.common.collect.ImmutableList;
import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;
import java.util.List;

import static com.alibaba.partgen.optimizer.partition.PartitionTestUtil.datums;

public class ImplicitRangeBoundResolverTest {

    private final ImplicitRangeBoundResolver resolver = new ImplicitRangeBoundResolver(new PartitionBoundComparator(
        PartitionTestUtil.key(PartitionStrategy.RANGE, PartitionTestUtil.intColumn("j"))));

    private static GeneratedPartition partition(String name, PartitionBound bound) {
        return new GeneratedPartition(PartitionTestUtil.SCHEMA, name, "sales", bound, Collections.emptyMap(),
            null, null, Collections.emptyList(), null);
    }

    private static void assertContiguous(List<GeneratedPartition> partitions) {
        for (int i = 1; i < partitions.size(); i++) {
            PartitionBound bound = partitions.get(i).getBound();
            if (!bound.isDefault()) {
                Assert.assertEquals(partitions.get(i - 1).getBound().getUpper(), bound.getLower());
            }
        }
    }

    @Test
    public void testStartOnly() {
        List<GeneratedPartition> resolved = resolver.resolve(ImmutableList.of(
            partition("p3", PartitionBound.range(datums(20), null)),
            partition("p1", PartitionBound.range(datums(1), null)),
            partition("p2", PartitionBound.range(datums(10), null))));

        Assert.assertEquals("p1", resolved.get(0).getName());
        Assert.assertEquals("p2", resolved.get(1).getName());
        Assert.assertEquals("p3", resolved.get(2).getName());
        Assert.assertEquals(datums(10), resolved.get(0).getBound().getUpper());
        Assert.assertEquals(datums(20), resolved.get(1).getBound().getUpper());
        Assert.assertEquals(ImmutableList.of(RangeDatum.maxValue()), resolved.get(2).getBound().getUpper());
        assertContiguous(resolved);
    }

    @Test
    public void testEndOnly() {
        List<GeneratedPartition> resolved = resolver.resolve(ImmutableList.of(
            partition("p2", PartitionBound.range(null, datums(20))),
            partition("p1", PartitionBound.range(null, datums(10)))));

        Assert.assertEquals("p1", resolved.get(0).getName());
        Assert.assertEquals(ImmutableList.of(RangeDatum.minValue()), resolved.get(0).getBound().getLower());
        Assert.assertEquals(datums(10), resolved.get(1).getBound().getLower());
        assertContiguous(resolved);
    }

    @Test
    public void testEndMeetsStart() {
        List<GeneratedPartition> resolved = resolver.resolve(ImmutableList.of(
            partition("a", PartitionBound.range(datums(10), null)),
            partition("b", PartitionBound.range(null, datums(10))),
            partition("other", PartitionBound.defaultBound())));

        Assert.assertEquals("b", resolved.get(0).getName());
        Assert.assertEquals("a", resolved.get(1).getName());
        Assert.assertEquals("other", resolved.get(2).getName());
        Assert.assertEquals(ImmutableList.of(RangeDatum.minValue()), resolved.get(0).getBound().getLower());
        Assert.assertEquals(ImmutableList.of(RangeDatum.maxValue()), resolved.get(1).getBound().getUpper());
        assertContiguous(resolved);
    }

    @Test
    public void testExplicitBoundsUntouched() {
        GeneratedPartition p1 = partition("p1", PartitionBound.range(datums(1), datums(5)));
        GeneratedPartition p2 = partition("p2", PartitionBound.range(datums(5), datums(9)));
        List<GeneratedPartition> resolved = resolver.resolve(ImmutableList.of(p2, p1));
        Assert.assertSame(p1, resolved.get(0));
        Assert.assertSame(p2, resolved.get(1));
    }

    @Test
    public void testCannotDeduce() {
        try {
            resolver.resolve(ImmutableList.of(
                partition("p1", PartitionBound.range(null, datums(5))),
                partition("p2", PartitionBound.range(null, datums(9))),
                partition("p0", PartitionBound.range(datums(1), null))));
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_INVALID_SPEC, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("cannot deduce implicit bound for partition"));
            Assert.assertFalse(e.hasPosition());
        }
    }

    @Test
    public void testCannotDeduceReportsElementLocation() {
        try {
            resolver.resolve(ImmutableList.of(
                partition("p1", PartitionBound.range(null, datums(5))),
                partition("p2", PartitionBound.range(null, datums(9))),
                partition("p0", PartitionBound.range(datums(1), null))), partition -> 77);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_INVALID_SPEC, e.getErrorCodeType());
            Assert.assertEquals(77, e.getPosition());
        }
    }
}
