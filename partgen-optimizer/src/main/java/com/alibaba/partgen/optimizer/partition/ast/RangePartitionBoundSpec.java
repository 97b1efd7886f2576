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

package com.alibaba.partgen.optimizer.partition.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@code START (...) [INCLUSIVE|EXCLUSIVE] END (...) [INCLUSIVE|EXCLUSIVE] EVERY (...)}. Any of the
 * three lists may be absent. START is always inclusive; an exclusive START is rewritten by the parser.
 */
public class RangePartitionBoundSpec implements PartitionBoundSpec {

    private final List<PartitionValueExpr> start;
    private final List<PartitionValueExpr> end;
    private final boolean endInclusive;
    private final List<PartitionValueExpr> every;
    private final int location;

    public RangePartitionBoundSpec(List<PartitionValueExpr> start, List<PartitionValueExpr> end,
                                   boolean endInclusive, List<PartitionValueExpr> every, int location) {
        this.start = start;
        this.end = end;
        this.endInclusive = endInclusive;
        this.every = every;
        this.location = location;
    }

    public List<PartitionValueExpr> getStart() {
        return start;
    }

    public List<PartitionValueExpr> getEnd() {
        return end;
    }

    public boolean isEndInclusive() {
        return endInclusive;
    }

    public List<PartitionValueExpr> getEvery() {
        return every;
    }

    @Override
    public int getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RangePartitionBoundSpec that = (RangePartitionBoundSpec) o;
        return endInclusive == that.endInclusive && location == that.location && Objects.equals(start, that.start)
            && Objects.equals(end, that.end) && Objects.equals(every, that.every);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, endInclusive, every, location);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (start != null) {
            sb.append("START (").append(join(start)).append(')');
        }
        if (end != null) {
            sb.append(sb.length() > 0 ? " " : "").append("END (").append(join(end)).append(')');
            if (endInclusive) {
                sb.append(" INCLUSIVE");
            }
        }
        if (every != null) {
            sb.append(sb.length() > 0 ? " " : "").append("EVERY (").append(join(every)).append(')');
        }
        return sb.toString();
    }

    private static String join(List<PartitionValueExpr> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
