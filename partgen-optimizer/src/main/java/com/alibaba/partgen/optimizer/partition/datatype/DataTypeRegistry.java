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

package com.alibaba.partgen.optimizer.partition.datatype;

import com.alibaba.partgen.common.collation.CollationHandler;
import com.alibaba.partgen.common.collation.CollationHandlers;
import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.common.utils.Assert;
import org.apache.commons.lang3.StringUtils;

import java.util.Comparator;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Registry of partition key data types, by name and alias.
 *
 * <p>{@link #getInstance()} holds the built-in types only. Callers that need custom types create their
 * own registry and {@link #register(PartitionDataType, String...)} them there.
 */
public class DataTypeRegistry implements OperatorResolver {

    private static final DataTypeRegistry INSTANCE = new DataTypeRegistry().freeze();

    private final Map<String, PartitionDataType> types = new ConcurrentHashMap<>();

    private volatile boolean frozen = false;

    public DataTypeRegistry() {
        register(IntegerDataType.SMALLINT, "int2");
        register(IntegerDataType.INTEGER, "int", "int4");
        register(IntegerDataType.BIGINT, "int8");
        register(NumericDataType.NUMERIC, "decimal");
        register(DateDataType.DATE);
        register(TimestampDataType.TIMESTAMP, "timestamp");
        register(TimestampTzDataType.TIMESTAMPTZ, "timestamptz");
        register(TextDataType.TEXT);
        register(TextDataType.VARCHAR, "varchar");
    }

    public static DataTypeRegistry getInstance() {
        return INSTANCE;
    }

    private DataTypeRegistry freeze() {
        this.frozen = true;
        return this;
    }

    public void register(PartitionDataType type, String... aliases) {
        Assert.assertNotNull(type, "data type");
        if (frozen) {
            throw new PartGenRuntimeException(ErrorCode.ERR_NOT_SUPPORT,
                "registering data types in the shared registry");
        }
        types.put(normalize(type.getName()), type);
        for (String alias : aliases) {
            types.put(normalize(alias), type);
        }
    }

    @Override
    public PartitionDataType resolveType(String typeName) {
        PartitionDataType type = types.get(normalize(typeName));
        if (type == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_NOT_SUPPORT,
                "partition key of type " + typeName);
        }
        return type;
    }

    public boolean isRegistered(String typeName) {
        return types.containsKey(normalize(typeName));
    }

    @Override
    public UnaryOperator<Object> resolvePlusOperator(PartitionDataType type, Object step) {
        return type.plus(step);
    }

    @Override
    public Comparator<Object> resolveComparator(PartitionDataType type, String collation) {
        CollationHandler handler = type.isCollatable() ? CollationHandlers.getHandler(collation) : null;
        return (value1, value2) -> type.compare(value1, value2, handler);
    }

    private static String normalize(String typeName) {
        return StringUtils.normalizeSpace(StringUtils.defaultString(typeName)).toLowerCase(Locale.ROOT);
    }
}
