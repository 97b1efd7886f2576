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

import java.util.function.UnaryOperator;

/**
 * text and character varying. A varchar typmod is the maximum length; -1 means unlimited. There is
 * no "+" for character data, so these columns cannot be used with EVERY.
 */
public class TextDataType extends AbstractPartitionDataType {

    public static final TextDataType TEXT = new TextDataType("text", false);
    public static final TextDataType VARCHAR = new TextDataType("character varying", true);

    private final boolean lengthLimited;

    public TextDataType(String name, boolean lengthLimited) {
        super(name);
        this.lengthLimited = lengthLimited;
    }

    @Override
    public Object cast(Object value, int typmod) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value);
        if (lengthLimited && typmod >= 0 && text.codePointCount(0, text.length()) > typmod) {
            throw new PartGenRuntimeException(ErrorCode.ERR_PARTITION_TYPE_MISMATCH,
                "value too long for type " + name + "(" + typmod + ")");
        }
        return text;
    }

    @Override
    public int compare(Object value1, Object value2, CollationHandler collation) {
        CollationHandler handler = collation == null ? CollationHandlers.DEFAULT_HANDLER : collation;
        return handler.compare((String) value1, (String) value2);
    }

    @Override
    public UnaryOperator<Object> plus(Object step) {
        return null;
    }

    @Override
    public boolean isCollatable() {
        return true;
    }
}
