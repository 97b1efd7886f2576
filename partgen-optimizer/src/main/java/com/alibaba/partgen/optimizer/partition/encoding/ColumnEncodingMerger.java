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

package com.alibaba.partgen.optimizer.partition.encoding;

import com.alibaba.partgen.common.exception.PartGenRuntimeException;
import com.alibaba.partgen.common.exception.code.ErrorCode;
import com.alibaba.partgen.common.utils.GeneralUtil;
import com.alibaba.partgen.optimizer.partition.ast.ColumnEncodingDirective;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Merges {@code COLUMN ... ENCODING} directives of an inner level with those of an outer level.
 * <ol>
 * <li>a column named at the inner level keeps its inner directive;</li>
 * <li>outer directives for columns the inner level does not name are appended;</li>
 * <li>the outer default directive is appended only when the inner level has none.</li>
 * </ol>
 * Used for partition configuration over parent table, and for element over partition configuration.
 */
public class ColumnEncodingMerger {

    private ColumnEncodingMerger() {
    }

    /**
     * @param inner directives of the more specific level, may be {@code null}
     * @param outer directives of the enclosing level, may be {@code null}
     * @return a new list; the arguments are not modified
     */
    public static List<ColumnEncodingDirective> merge(List<ColumnEncodingDirective> inner,
                                                      List<ColumnEncodingDirective> outer) {
        return merge(inner, outer, PartGenRuntimeException.UNKNOWN_POSITION);
    }

    /**
     * @param location source position of the inner level's clause, reported with a duplicate default
     */
    public static List<ColumnEncodingDirective> merge(List<ColumnEncodingDirective> inner,
                                                      List<ColumnEncodingDirective> outer, int location) {
        if (GeneralUtil.isEmpty(outer)) {
            checkSingleDefault(inner, location);
            return inner == null ? new ArrayList<>() : new ArrayList<>(inner);
        }
        if (GeneralUtil.isEmpty(inner)) {
            checkSingleDefault(outer, location);
            return new ArrayList<>(outer);
        }

        ColumnEncodingDirective innerDefault = checkSingleDefault(inner, location);
        ColumnEncodingDirective outerDefault = checkSingleDefault(outer, location);

        List<ColumnEncodingDirective> merged = new ArrayList<>(inner);
        for (ColumnEncodingDirective directive : outer) {
            if (directive.isDefault()) {
                continue;
            }
            if (!mentionsColumn(inner, directive.getColumn())) {
                merged.add(directive);
            }
        }
        if (innerDefault == null && outerDefault != null) {
            merged.add(outerDefault);
        }
        return merged;
    }

    private static boolean mentionsColumn(List<ColumnEncodingDirective> directives, String column) {
        for (ColumnEncodingDirective directive : directives) {
            if (!directive.isDefault() && Objects.equals(directive.getColumn(), column)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the default directive of the list, or {@code null}
     */
    private static ColumnEncodingDirective checkSingleDefault(List<ColumnEncodingDirective> directives,
                                                              int location) {
        ColumnEncodingDirective found = null;
        for (ColumnEncodingDirective directive : GeneralUtil.emptyIfNull(directives)) {
            if (directive.isDefault()) {
                if (found != null) {
                    throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_DUPLICATE_DEFAULT, location,
                        "DEFAULT COLUMN ENCODING clause specified more than once for partition");
                }
                found = directive;
            }
        }
        return found;
    }
}
