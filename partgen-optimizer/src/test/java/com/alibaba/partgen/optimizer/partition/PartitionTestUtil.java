package com.alibaba.partgen.optimizer.partition;

import com.alibaba.partgen.optimizer.partition.ast.ListPartitionBoundSpec;
import com.alibaba.partgen.optimizer.partition.ast.PartitionDefinitionElement;
import com.alibaba.partgen.optimizer.partition.ast.PartitionValueExpr;
import com.alibaba.partgen.optimizer.partition.ast.RangePartitionBoundSpec;
import com.alibaba.partgen.optimizer.partition.bound.RangeDatum;
import com.alibaba.partgen.optimizer.partition.datatype.DataTypeRegistry;
import com.alibaba.partgen.optimizer.partition.datatype.IntegerDataType;
import com.alibaba.partgen.optimizer.partition.meta.ColumnMeta;
import com.alibaba.partgen.optimizer.partition.meta.PartitionKey;
import com.alibaba.partgen.optimizer.partition.meta.PartitionedRelation;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

public class PartitionTestUtil {

    public static final String SCHEMA = "public";

    public static ColumnMeta intColumn(String name) {
        return new ColumnMeta(name, IntegerDataType.INTEGER);
    }

    public static PartitionKey key(PartitionStrategy strategy, ColumnMeta... columns) {
        return new PartitionKey(strategy, ImmutableList.copyOf(columns), DataTypeRegistry.getInstance());
    }

    /**
     * Table {@code name (i int, j int, k int)} partitioned on j.
     */
    public static PartitionedRelation.Builder relation(String name, PartitionStrategy strategy) {
        ColumnMeta i = intColumn("i");
        ColumnMeta j = intColumn("j");
        ColumnMeta k = intColumn("k");
        return PartitionedRelation.builder(SCHEMA, name)
            .columns(ImmutableList.of(i, j, k))
            .partitionKey(key(strategy, j));
    }

    public static List<PartitionValueExpr> values(Object... values) {
        List<PartitionValueExpr> exprs = new ArrayList<>(values.length);
        for (Object value : values) {
            exprs.add(value instanceof PartitionValueExpr ? (PartitionValueExpr) value : PartitionValueExpr.of(value));
        }
        return exprs;
    }

    private static List<PartitionValueExpr> single(Object value) {
        return value == null ? null : values(new Object[] {value});
    }

    public static RangePartitionBoundSpec rangeBound(Object start, Object end, Object every) {
        return new RangePartitionBoundSpec(single(start), single(end), false, single(every),
            PartitionValueExpr.UNKNOWN_LOCATION);
    }

    public static PartitionDefinitionElement range(String name, Object start, Object end) {
        return range(name, start, end, null);
    }

    public static PartitionDefinitionElement range(String name, Object start, Object end, Object every) {
        return PartitionDefinitionElement.builder().name(name).bound(rangeBound(start, end, every)).build();
    }

    public static PartitionDefinitionElement list(String name, Object... values) {
        List<List<PartitionValueExpr>> tuples = new ArrayList<>();
        for (Object value : values) {
            tuples.add(values(new Object[] {value}));
        }
        return PartitionDefinitionElement.builder()
            .name(name)
            .bound(new ListPartitionBoundSpec(tuples, PartitionValueExpr.UNKNOWN_LOCATION))
            .build();
    }

    public static PartitionDefinitionElement defaultPartition(String name) {
        return PartitionDefinitionElement.builder().name(name).asDefault().build();
    }

    public static List<RangeDatum> datums(long value) {
        return ImmutableList.of(RangeDatum.of(value));
    }

    public static Object lower(GeneratedPartition partition) {
        return partition.getBound().getLower().get(0).getValue();
    }

    public static Object upper(GeneratedPartition partition) {
        return partition.getBound().getUpper().get(0).getValue();
    }
}
