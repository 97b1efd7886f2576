package com.alibaba.partgen.optimizer.partition.expr;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.optimizer.partition.ast.PartitionValueExpr;
import com.alibaba.partgen.optimizer.partition.datatype.DateDataType;
import com.alibaba.partgen.optimizer.partition.datatype.IntegerDataType;
import com.alibaba.partgen.optimizer.partition.datatype.TextDataType;
import com.alibaba.partgen.optimizer.partition.meta.ColumnMeta;
import org.junit.Assert;
import org.junit.Test;

import java.time.LocalDate;

public class PartitionBoundValueTransformerTest {

    @Test
    public void testCastToColumnType() {
        ColumnMeta dateColumn = new ColumnMeta("d", DateDataType.DATE);
        Assert.assertEquals(LocalDate.of(2021, 6, 1),
            PartitionBoundValueTransformer.transform(dateColumn, PartitionValueExpr.of("2021-06-01")));
        Assert.assertNull(PartitionBoundValueTransformer.transform(dateColumn, PartitionValueExpr.nullValue()));
    }

    @Test
    public void testCannotCast() {
        ColumnMeta intColumn = new ColumnMeta("j", IntegerDataType.INTEGER);
        try {
            PartitionBoundValueTransformer.transform(intColumn, PartitionValueExpr.of("abc").at(7));
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_TYPE_MISMATCH, e.getErrorCodeType());
            Assert.assertTrue(
                e.getMessage().contains("specified value cannot be cast to type integer for column \"j\""));
            Assert.assertEquals(7, e.getPosition());
        }
    }

    @Test
    public void testCollation() {
        ColumnMeta textColumn = new ColumnMeta("c", TextDataType.TEXT, -1, "en_US");
        Assert.assertEquals("a", PartitionBoundValueTransformer.transform(textColumn,
            PartitionValueExpr.of("a").collate("en_US")));
        // the default collation is replaced by the key's one
        Assert.assertEquals("a", PartitionBoundValueTransformer.transform(textColumn,
            PartitionValueExpr.of("a").collate("default")));
        try {
            PartitionBoundValueTransformer.transform(textColumn, PartitionValueExpr.of("a").collate("C"));
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_PARTITION_TYPE_MISMATCH, e.getErrorCodeType());
        }
    }
}
