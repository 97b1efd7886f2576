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
import com.alibaba.partgen.optimizer.partition.GeneratedPartition;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Sorts the RANGE partitions of one level and fills in the bounds a START-only or END-only element
 * left out: a missing lower bound is the previous partition's upper bound (MINVALUE for the first),
 * a missing upper bound is the next partition's lower bound (MAXVALUE for the last). The default
 * partition takes no part in this and stays last.
 */
public class ImplicitRangeBoundResolver {

    private final Comparator<GeneratedPartition> comparator;

    public ImplicitRangeBoundResolver(PartitionBoundComparator boundComparator) {
        this.comparator = Comparator.comparing(GeneratedPartition::getBound, boundComparator);
    }

    public List<GeneratedPartition> resolve(List<GeneratedPartition> partitions) {
        return resolve(partitions, partition -> PartGenRuntimeException.UNKNOWN_POSITION);
    }

    /**
     * @param locator source position of the element a partition was generated from, for error reports
     */
    public List<GeneratedPartition> resolve(List<GeneratedPartition> partitions,
                                            ToIntFunction<GeneratedPartition> locator) {
        List<GeneratedPartition> sorted = new ArrayList<>(partitions);
        sorted.sort(comparator);

        List<GeneratedPartition> ranges = new ArrayList<>(sorted.size());
        List<GeneratedPartition> defaults = new ArrayList<>(1);
        for (GeneratedPartition partition : sorted) {
            if (partition.getBound().isDefault()) {
                defaults.add(partition);
            } else {
                ranges.add(partition);
            }
        }

        List<GeneratedPartition> result = new ArrayList<>(sorted.size());
        for (int i = 0; i < ranges.size(); i++) {
            GeneratedPartition partition = ranges.get(i);
            PartitionBound bound = partition.getBound();
            if (!bound.hasLower()) {
                if (i == 0) {
                    bound = bound.withLower(ImmutableList.of(RangeDatum.minValue()));
                } else {
                    bound = bound.withLower(result.get(i - 1).getBound().getUpper());
                }
            }
            if (!bound.hasUpper()) {
                if (i == ranges.size() - 1) {
                    bound = bound.withUpper(ImmutableList.of(RangeDatum.maxValue()));
                } else {
                    PartitionBound nextBound = ranges.get(i + 1).getBound();
                    if (!nextBound.hasLower()) {
                        throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_INVALID_SPEC,
                            locator.applyAsInt(partition),
                            "cannot deduce implicit bound for partition \"" + partition.getName() + "\"");
                    }
                    bound = bound.withUpper(nextBound.getLower());
                }
            }
            result.add(bound == partition.getBound() ? partition : partition.withBound(bound));
        }
        result.addAll(defaults);
        return result;
    }
}
