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

package com.alibaba.partgen.optimizer.partition.bound;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.optimizer.partition.ast.PartitionValueExpr;
import com.alibaba.partgen.optimizer.partition.expr.PartitionBoundValueTransformer;
import com.alibaba.partgen.optimizer.partition.expr.PlusExpression;
import com.alibaba.partgen.optimizer.partition.expr.PlusExpressionCompiler;
import com.alibaba.partgen.optimizer.partition.meta.ColumnMeta;
import com.alibaba.partgen.optimizer.partition.meta.PartitionKey;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Walks the partitions of a {@code START (s) END (e) EVERY (step)} clause: [s, s+step),
 * [s+step, s+2*step), ... with the last upper bound clamped to e. Without EVERY, the whole clause is
 * a single partition. A lower bound is only produced when START is given and an upper bound only when
 * END is given; the missing ones are deduced from the neighbours later.
 *
 * <p>Forward only. The compiled "+" expression is released by {@link #close()}.
 */
public class PartEveryIterator implements Iterator<PartitionBound>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PartEveryIterator.class);

    enum State {
        NOT_STARTED,
        ADVANCING,
        REACHED,
        DONE
    }

    private final PartitionKey partitionKey;
    private final boolean hasStart;
    private final boolean hasEnd;
    private final Object endValue;
    private final PlusExpression plusExpression;
    private final int maxPartitions;
    private final int endLocation;
    private final int everyLocation;

    private State state = State.NOT_STARTED;
    private Object currStart;
    private Object currEnd;
    private int produced = 0;

    /**
     * @param maxPartitions upper limit of produced partitions, 0 for no limit
     */
    public PartEveryIterator(PartitionKey partitionKey, PlusExpressionCompiler compiler, PartitionValueExpr start,
                             PartitionValueExpr end, boolean endInclusive, PartitionValueExpr every,
                             int maxPartitions) {
        this.partitionKey = partitionKey;
        this.maxPartitions = maxPartitions;
        this.hasStart = start != null;
        this.hasEnd = end != null;
        this.endLocation = end == null ? PartitionValueExpr.UNKNOWN_LOCATION : end.getLocation();
        this.everyLocation = every == null ? PartitionValueExpr.UNKNOWN_LOCATION : every.getLocation();

        ColumnMeta column = partitionKey.getColumn(0);
        Object startValue = null;
        if (start != null) {
            startValue = transformNotNull(column, start);
        }
        Object canonicalEnd = null;
        if (end != null) {
            canonicalEnd = compiler.canonicalizeRangeEnd(column, transformNotNull(column, end), endInclusive);
        }
        this.endValue = canonicalEnd;

        if (every != null) {
            if (start == null || end == null) {
                throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, every.getLocation(),
                    "EVERY clause requires START and END");
            }
            this.plusExpression = compiler.compile(column, every);
        } else {
            this.plusExpression = null;
        }
        this.currEnd = startValue;
    }

    private static Object transformNotNull(ColumnMeta column, PartitionValueExpr expr) {
        Object value = PartitionBoundValueTransformer.transform(column, expr);
        if (value == null) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_NULL_BOUND, expr.getLocation(),
                "cannot use NULL with range partition specification");
        }
        return value;
    }

    @Override
    public boolean hasNext() {
        return state == State.NOT_STARTED || state == State.ADVANCING;
    }

    @Override
    public PartitionBound next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        boolean firstCall = state == State.NOT_STARTED;
        if (plusExpression != null) {
            advance(firstCall);
        } else {
            currStart = currEnd;
            currEnd = endValue;
            state = State.DONE;
        }
        produced++;
        if (maxPartitions > 0 && produced > maxPartitions) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC, everyLocation,
                "EVERY clause produces more than " + maxPartitions + " partitions");
        }

        List<RangeDatum> lower = hasStart ? ImmutableList.of(RangeDatum.of(currStart)) : null;
        List<RangeDatum> upper = hasEnd ? ImmutableList.of(RangeDatum.of(currEnd)) : null;
        return PartitionBound.range(lower, upper);
    }

    private void advance(boolean firstCall) {
        Object next = plusExpression.evaluate(currEnd);
        currStart = currEnd;

        if (partitionKey.compare(0, next, endValue) >= 0) {
            currEnd = endValue;
            state = State.REACHED;
        } else {
            // the step must move forward, otherwise this never terminates
            if (partitionKey.compare(0, currEnd, next) >= 0) {
                if (firstCall) {
                    throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_ARITHMETIC, everyLocation,
                        "EVERY parameter too small");
                }
                throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_ARITHMETIC, endLocation,
                    "END parameter not reached before type overflows");
            }
            currEnd = next;
            state = State.ADVANCING;
        }
        if (logger.isDebugEnabled()) {
            logger.debug("EVERY step " + (produced + 1) + ": [" + currStart + ", " + currEnd + ")"
                + (state == State.REACHED ? ", END reached" : ""));
        }
    }

    State getState() {
        return state;
    }

    public boolean isUsingEvery() {
        return plusExpression != null;
    }

    boolean isReleased() {
        return plusExpression == null || plusExpression.getContext().isClosed();
    }

    @Override
    public void close() {
        if (plusExpression != null) {
            plusExpression.close();
        }
    }
}
