package com.alibaba.partgen.common.properties;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import org.junit.Assert;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

public class ParamManagerTest {

    @Test
    public void testDefaults() {
        ParamManager paramManager = ParamManager.getDefault();
        Assert.assertEquals(63, paramManager.getInt(PartitionParams.MAX_IDENTIFIER_LENGTH));
        Assert.assertEquals("prt_", paramManager.getString(PartitionParams.PARTITION_NAME_PREFIX));
        Assert.assertEquals(0, paramManager.getInt(PartitionParams.MAX_PARTITIONS_PER_ELEMENT));
        Set<String> methods = paramManager.getStringSet(PartitionParams.COLUMN_ORIENTED_ACCESS_METHODS);
        Assert.assertEquals(1, methods.size());
        Assert.assertTrue(methods.contains("aoco"));
    }

    @Test
    public void testOverride() {
        Map<String, String> props = new HashMap<>();
        props.put(PartitionProperties.MAX_IDENTIFIER_LENGTH, "20");
        props.put(PartitionProperties.COLUMN_ORIENTED_ACCESS_METHODS, " AOCO , columnstore ,");
        ParamManager paramManager = new ParamManager(props);
        Assert.assertEquals(20, paramManager.getInt(PartitionParams.MAX_IDENTIFIER_LENGTH));
        Set<String> methods = paramManager.getStringSet(PartitionParams.COLUMN_ORIENTED_ACCESS_METHODS);
        Assert.assertEquals(2, methods.size());
        Assert.assertTrue(methods.contains("aoco"));
        Assert.assertTrue(methods.contains("columnstore"));
    }

    @Test
    public void testEmptyAccessMethodList() {
        Map<String, String> props = new HashMap<>();
        props.put(PartitionProperties.COLUMN_ORIENTED_ACCESS_METHODS, "");
        ParamManager paramManager = new ParamManager(props);
        Assert.assertTrue(paramManager.getStringSet(PartitionParams.COLUMN_ORIENTED_ACCESS_METHODS).isEmpty());
    }

    @Test
    public void testUnknownParam() {
        Map<String, String> props = new HashMap<>();
        props.put("NO_SUCH_PARAM", "1");
        try {
            new ParamManager(props);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_CONFIG, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("NO_SUCH_PARAM"));
        }
    }

    @Test
    public void testOutOfRangeValue() {
        Map<String, String> props = new HashMap<>();
        props.put(PartitionProperties.MAX_IDENTIFIER_LENGTH, "0");
        try {
            new ParamManager(props);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_CONFIG, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("MAX_IDENTIFIER_LENGTH must be between 1 and 1024, got 0"));
        }

        props.put(PartitionProperties.MAX_IDENTIFIER_LENGTH, "abc");
        try {
            new ParamManager(props);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_CONFIG, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("MAX_IDENTIFIER_LENGTH expects an integer, got \"abc\""));
        }
    }

    @Test
    public void testEmptyPrefixRejected() {
        Map<String, String> props = new HashMap<>();
        props.put(PartitionProperties.PARTITION_NAME_PREFIX, " ");
        try {
            new ParamManager(props);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_CONFIG, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("PARTITION_NAME_PREFIX can not be empty"));
        }
    }

    @Test
    public void testPartitionLimitRange() {
        Map<String, String> props = new HashMap<>();
        props.put(PartitionProperties.MAX_PARTITIONS_PER_ELEMENT, " 500 ");
        Assert.assertEquals(500, new ParamManager(props).getInt(PartitionParams.MAX_PARTITIONS_PER_ELEMENT));

        props.put(PartitionProperties.MAX_PARTITIONS_PER_ELEMENT, "-1");
        try {
            new ParamManager(props);
            Assert.fail();
        } catch (PartGenRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_CONFIG, e.getErrorCodeType());
            Assert.assertTrue(e.getMessage().contains("MAX_PARTITIONS_PER_ELEMENT must be between 0 and"));
        }
    }
}
