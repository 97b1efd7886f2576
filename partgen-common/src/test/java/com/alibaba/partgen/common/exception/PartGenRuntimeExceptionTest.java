package com.alibaba.partgen.common.exception;

import com.alibaba.partgen.common.exception.code.ErrorCode;
import org.junit.Assert;
import org.junit.Test;

public class PartGenRuntimeExceptionTest {

    @Test
    public void testMessageCarriesCodeName() {
        PartGenRuntimeException e =
            new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, "EVERY clause requires START and END");
        Assert.assertTrue(e.getMessage().contains("ERR_PARTITION_INVALID_SPEC"));
        Assert.assertTrue(e.getMessage().contains("PXC-4600"));
        Assert.assertTrue(e.getMessage().endsWith("EVERY clause requires START and END"));
        Assert.assertEquals(ErrorCode.ERR_PARTITION_INVALID_SPEC, e.getErrorCodeType());
        Assert.assertEquals(4600, e.getErrorCode());
        Assert.assertFalse(e.hasPosition());
    }

    @Test
    public void testPosition() {
        PartGenRuntimeException e =
            new PartGenRuntimeException(ErrorCode.ERR_PARTITION_ARITHMETIC, 42, "EVERY parameter too small");
        Assert.assertTrue(e.hasPosition());
        Assert.assertEquals(42, e.getPosition());
        Assert.assertTrue(e.getErrorCodeType().isDefinitionError());
    }

    @Test
    public void testCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        PartGenRuntimeException e = new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TEMPLATE, cause, "bad json");
        Assert.assertSame(cause, e.getCause());
        Assert.assertTrue(e.getMessage().contains("Failed to process partition template: bad json"));
        Assert.assertFalse(e.getErrorCodeType().isDefinitionError());
    }

    @Test
    public void testAtPosition() {
        PartGenRuntimeException unplaced =
            new PartGenRuntimeException(ErrorCode.ERR_PARTITION_ARITHMETIC, "integer out of range");
        PartGenRuntimeException placed = unplaced.atPosition(17);
        Assert.assertEquals(17, placed.getPosition());
        Assert.assertEquals(unplaced.getMessage(), placed.getMessage());
        Assert.assertEquals(ErrorCode.ERR_PARTITION_ARITHMETIC, placed.getErrorCodeType());
        Assert.assertSame(unplaced, placed.getCause());

        Assert.assertSame(placed, placed.atPosition(99));
        Assert.assertSame(unplaced, unplaced.atPosition(PartGenRuntimeException.UNKNOWN_POSITION));
    }
}
