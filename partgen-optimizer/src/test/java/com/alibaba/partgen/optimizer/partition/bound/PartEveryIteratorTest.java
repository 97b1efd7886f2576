package com.alibaba.partgen.optimizer.partition.bound;

import com.alibaba.partgen.common.collation.CollationHandler;
import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.optimizer.partition.PartitionStrategy;
import com.alibaba.partgen.optimizer.partition.PartitionTestUtil;
import com.alibaba.partgen.optimizer.partition.ast.PartitionValueExpr;
import com.alibaba.partgen.optimizer.partition.datatype.DataTypeRegistry;
import com.alibaba.partgen.optimizer.partition.datatype.DateDataType;
import com.alibaba.partgen.optimizer.partition.datatype.PartitionDataType;
import com.alibaba.partgen.optimizer.partition.expr.PlusExpressionCompiler;
import com.alibaba.partgen.optimizer.partition.meta.ColumnMeta;
import com.alibaba.partgen.optimizer.partition.meta.PartitionKey;
import org.junit.Assert;
import org.junit.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

public class PartEveryIteratorTest {

    private final PlusExpressionCompiler compiler = new PlusExpressionCompiler(DataTypeRegistry.getInstance());

    private final PartitionKey intKey =
        PartitionTestUtil.key(PartitionStrategy.RANGE, PartitionTestUtil.intColumn("j"));

    private static PartitionValueExpr value(Object value) {
        return value == null ? null : PartitionValueExpr.of(value);
    }

    private PartEveryIterator iterator(PartitionKey key, Object start, Object end, boolean inclusive, Object every,
                                       int maxPartitions) {
        return new PartEveryIterator(key, compiler, value(start), value(end), inclusive, value(every),
            maxPartitions);
    }

    private static List<PartitionBound> drain(PartEveryIterator iterator) {
        List<PartitionBound> bounds = new ArrayList<>();
        try (PartEveryIterator it = iterator) {
            while (it.hasNext()) {
                bounds.add(it.next());
            }
        }
        return bounds;
    }

    private static void assertRange(PartitionBound bound, Object lower, Object upper) {
        Assert.assertEquals(lower, bound.getLower().get(0).getValue());
        Assert.assertEquals(upper, bound.getUpper().get(0).getValue());
    }

    @Test
    public void testEvenSteps() {
        List<PartitionBound> bounds = drain(iterator(intKey, 1, 10, false, 3, 0));
        Assert.assertEquals(3, bounds.size());
        assertRange(bounds.get(0), 1L, 4L);
        assertRange(bounds.get(1), 4L, 7L);
        assertRange(bounds.get(2), 7L, 10L);
    }

    @Test
    public void testLastStepClamped() {
        List<PartitionBound> bounds = drain(iterator(intKey, 1, 10, false, 4, 0));
        Assert.assertEquals(3, bounds.size());
        assertRange(bounds.get(0), 1L, 5L);
        assertRange(bounds.get(1), 5L, 9L);
        assertRange(bounds.get(2), 9L, 10L);
    }

    @Test
    public void testWithoutEvery() {
        PartEveryIterator iterator = iterator(intKey, 1, 10, false, null, 0);
        Assert.assertFalse(iterator.isUsingEvery());
        List<PartitionBound> bounds = drain(iterator);
        Assert.assertEquals(1, bounds.size());
        assertRange(bounds.get(0), 1L, 10L);
        Assert.assertEquals(PartEveryIterator.State.DONE, iterator.getState());
    }

    @Test
    public void testInclusiveEnd() {
        List<PartitionBound> bounds = drain(iterator(intKey, 1, 9, true, 3, 0));
        Assert.assertEquals(3, bounds.size());
        assertRange(bounds.get(2), 7L, 10L);
    }

    @Test
    public void testOpenEnded() {
        List<PartitionBound> startOnly = drain(iterator(intKey, 5, null, false, null, 0));
        Assert.assertTrue(startOnly.get(0).hasLower());
        Assert.assertFalse(startOnly.get(0).hasUpper());

        List<PartitionBound> endOnly = drain(iterator(intKey, null, 5, false, null, 0));
        Assert.assertFalse(endOnly.get(0).hasLower());
        Assert.assertTrue(endOnly.get(0).hasUpper());
    }

    @Test
    public void testDateByInterval() {
        PartitionKey dateKey = PartitionTestUtil.key(PartitionStrategy.RANGE, new ColumnMeta("d", DateDataType.DATE));
        List<PartitionBound> bounds = drain(iterator(dateKey, "2020-01-01", "2020-04-01", false, "1 month", 0));
        Assert.assertEquals(3, bounds.size());
        assertRange(bounds.get(0), LocalDate.of(2020, 1, 1), LocalDate.of(2020, 2, 1));
        assertRange(bounds.get(1), LocalDate.of(2020, 2, 1), LocalDate.of(2020, 3, 1));
        assertRange(bounds.get(2), LocalDate.of(2020, 3, 1), LocalDate.of(2020, 4, 1));
    }

    @Test
    public void testZeroStep() {
        PartEveryIterator iterator = new PartEveryIterator(intKey, compiler, PartitionValueExpr.of(1),
            PartitionValueExpr.of(10), false, PartitionValueExpr.of(0).at(30), 0);
        try {
            drain(iterator);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_ARITHMETIC, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("EVERY parameter too small"));
            Assert.assertEquals(30, e.getPosition());
        }
        Assert.assertTrue(iterator.isReleased());
    }

    @Test
    public void testIntegerOverflow() {
        try {
            drain(new PartEveryIterator(intKey, compiler, PartitionValueExpr.of(2147483640),
                PartitionValueExpr.of(2147483647), false, PartitionValueExpr.of(5).at(18), 0));
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_ARITHMETIC, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("integer out of range"));
            Assert.assertEquals(18, e.getPosition());
        }
    }

    @Test
    public void testDateStepPastSupportedRange() {
        PartitionKey dateKey = PartitionTestUtil.key(PartitionStrategy.RANGE, new ColumnMeta("d", DateDataType.DATE));
        try {
            drain(new PartEveryIterator(dateKey, compiler, PartitionValueExpr.of("2020-01-01"),
                PartitionValueExpr.of("2020-02-01"), false, PartitionValueExpr.of(4000000000000L).at(55), 0));
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_ARITHMETIC, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("date out of range"));
            Assert.assertEquals(55, e.getPosition());
        }
    }

    @Test
    public void testWrappingTypeNeverReachesEnd() {
        PartitionKey wrappingKey =
            PartitionTestUtil.key(PartitionStrategy.RANGE, new ColumnMeta("w", new WrappingIntType()));
        PartEveryIterator iterator = new PartEveryIterator(wrappingKey, compiler, PartitionValueExpr.of(2147483640),
            PartitionValueExpr.of(2147483647).at(12), false, PartitionValueExpr.of(5), 0);
        Assert.assertEquals(PartEveryIterator.State.NOT_STARTED, iterator.getState());
        try {
            drain(iterator);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_ARITHMETIC, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("END parameter not reached before type overflows"));
            Assert.assertEquals(12, e.getPosition());
        }
        Assert.assertEquals(PartEveryIterator.State.ADVANCING, iterator.getState());
        Assert.assertTrue(iterator.isReleased());
    }

    @Test
    public void testEveryRequiresStartAndEnd() {
        try {
            iterator(intKey, null, 10, false, 2, 0);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_INVALID_SPEC, e.getErrorCodeType());
        }
    }

    @Test
    public void testNullStart() {
        try {
            new PartEveryIterator(intKey, compiler, PartitionValueExpr.nullValue(), PartitionValueExpr.of(10), false,
                null, 0);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_NULL_BOUND, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("cannot use NULL with range partition specification"));
        }
    }

    @Test
    public void testPartitionLimit() {
        try {
            drain(iterator(intKey, 1, 10, false, 3, 2));
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_INVALID_SPEC, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("more than 2 partitions"));
        }
    }

    @Test
    public void testNextAfterClose() {
        PartEveryIterator iterator = iterator(intKey, 1, 10, false, 3, 0);
        iterator.next();
        iterator.close();
        Assert.assertTrue(iterator.isReleased());
        try {
            iterator.next();
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_ASSERT_TRUE, e.getErrorCodeType());
        }
    }

    /**
     * A 32-bit integer whose "+" silently wraps around.
     */
    private static class WrappingIntType implements PartitionDataType {

        @Override
        public String getName() {
            return "wrapint";
        }

        @Override
        public Object cast(Object value, int typmod) {
            return value instanceof Number ? (Object) ((Number) value).intValue() : null;
        }

        @Override
        public int compare(Object value1, Object value2, CollationHandler collation) {
            return Integer.compare((Integer) value1, (Integer) value2);
        }

        @Override
        public UnaryOperator<Object> plus(Object step) {
            int increment = ((Number) step).intValue();
            return current -> (Integer) current + increment;
        }
    }
}
