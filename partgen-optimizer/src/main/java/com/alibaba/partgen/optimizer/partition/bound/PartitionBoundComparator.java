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

import com.alibaba.partgen.optimizer.partition.meta.PartitionKey;

import java.util.Comparator;
import java.util.List;

/**
 * Order of sibling partitions: default partition last, then by lower bound when both have one,
 * else by upper bound when both have one, else lower against upper.
 *
 * <p>When one side only has a lower bound and the other only an upper bound and the two are equal,
 * the side with the upper bound sorts first, so that the other one can take that upper bound as its
 * missing lower bound.
 */
public class PartitionBoundComparator implements Comparator<PartitionBound> {

    private final PartitionKey partitionKey;

    public PartitionBoundComparator(PartitionKey partitionKey) {
        this.partitionKey = partitionKey;
    }

    @Override
    public int compare(PartitionBound bound1, PartitionBound bound2) {
        if (bound1.isDefault() || bound2.isDefault()) {
            return Boolean.compare(bound1.isDefault(), bound2.isDefault());
        }
        if (bound1.hasLower() && bound2.hasLower()) {
            return compareDatums(bound1.getLower(), bound2.getLower());
        } else if (bound1.hasUpper() && bound2.hasUpper()) {
            return compareDatums(bound1.getUpper(), bound2.getUpper());
        } else if (bound1.hasLower() && bound2.hasUpper()) {
            int cmp = compareDatums(bound1.getLower(), bound2.getUpper());
            return cmp == 0 ? 1 : cmp;
        } else if (bound1.hasUpper() && bound2.hasLower()) {
            int cmp = compareDatums(bound1.getUpper(), bound2.getLower());
            return cmp == 0 ? -1 : cmp;
        }
        return 0;
    }

    private int compareDatums(List<RangeDatum> datums1, List<RangeDatum> datums2) {
        int cmp = 0;
        for (int i = 0; i < partitionKey.getColumnCount(); i++) {
            cmp = RangeDatum.compare(partitionKey, i, datums1.get(i), datums2.get(i));
            if (cmp != 0) {
                break;
            }
        }
        return cmp;
    }
}
