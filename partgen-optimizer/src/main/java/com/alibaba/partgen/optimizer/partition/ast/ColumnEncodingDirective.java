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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code COLUMN x ENCODING (...)} or, without a column, {@code DEFAULT COLUMN ENCODING (...)}.
 */
public class ColumnEncodingDirective {

    private final String column;
    private final Map<String, Object> options;
    private final boolean isDefault;

    private ColumnEncodingDirective(String column, Map<String, Object> options, boolean isDefault) {
        this.column = column;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
        this.isDefault = isDefault;
    }

    public static ColumnEncodingDirective forColumn(String column, Map<String, Object> options) {
        return new ColumnEncodingDirective(column, options, false);
    }

    public static ColumnEncodingDirective defaultEncoding(Map<String, Object> options) {
        return new ColumnEncodingDirective(null, options, true);
    }

    public String getColumn() {
        return column;
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    public boolean isDefault() {
        return isDefault;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ColumnEncodingDirective that = (ColumnEncodingDirective) o;
        return isDefault == that.isDefault && Objects.equals(column, that.column)
            && Objects.equals(options, that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, options, isDefault);
    }

    @Override
    public String toString() {
        return (isDefault ? "DEFAULT COLUMN" : "COLUMN " + column) + " ENCODING " + options;
    }
}
