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

package com.alibaba.partgen.common.exception.code;

import java.util.IllegalFormatException;

/**
 * Error codes raised while expanding a partition definition. Every code carries a numeric vendor code
 * and a message template whose {@code %s} placeholders are filled by the raising site.
 */
public enum ErrorCode {

    // ============= 通用 ==============
    ERR_CONFIG(4001, Category.ERR_INTERNAL, "%s"),

    ERR_ASSERT_NULL(4002, Category.ERR_INTERNAL, "Unexpected null value: %s"),

    ERR_ASSERT_TRUE(4003, Category.ERR_INTERNAL, "Assertion failure: %s"),

    ERR_ASSERT_FAIL(4004, Category.ERR_INTERNAL, "Unexpected state: %s"),

    ERR_NOT_SUPPORT(4005, Category.ERR_INTERNAL, "Not supported: %s"),

    // ============= 分区定义 ==============
    ERR_PARTITION_INVALID_SPEC(4600, Category.ERR_DEFINITION, "%s"),

    ERR_PARTITION_TYPE_MISMATCH(4601, Category.ERR_DEFINITION, "%s"),

    ERR_PARTITION_ARITHMETIC(4602, Category.ERR_DEFINITION, "%s"),

    ERR_PARTITION_NULL_BOUND(4603, Category.ERR_DEFINITION, "%s"),

    ERR_PARTITION_DUPLICATE_DEFAULT(4604, Category.ERR_DEFINITION, "%s"),

    ERR_PARTITION_TEMPLATE(4605, Category.ERR_INTERNAL, "Failed to process partition template: %s");

    public enum Category {
        ERR_INTERNAL,
        ERR_DEFINITION
    }

    private static final String PREFIX = "PXC-";

    private final int code;
    private final Category category;
    private final String template;

    ErrorCode(int code, Category category, String template) {
        this.code = code;
        this.category = category;
        this.template = template;
    }

    public int getCode() {
        return code;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isDefinitionError() {
        return category == Category.ERR_DEFINITION;
    }

    public String getMessage(String... params) {
        String detail;
        if (params == null || params.length == 0) {
            detail = template.replace("%s", "");
        } else {
            try {
                detail = String.format(template, (Object[]) params);
            } catch (IllegalFormatException e) {
                detail = String.join(" ", params);
            }
        }
        return "ERR-CODE: [" + PREFIX + code + "][" + name() + "] " + detail.trim();
    }
}
