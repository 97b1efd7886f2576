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

package com.alibaba.partgen.common.exception;

import com.alibaba.partgen.common.exception.code.ErrorCode;

/**
 * The only exception raised while expanding a partition definition. The error taxonomy is carried by
 * {@link ErrorCode}; {@link #getPosition()} points at the offending clause of the source text when it is
 * known, and is {@code -1} otherwise.
 */
public class PartGenRuntimeException extends RuntimeException {

    private static final long serialVersionUID = -654893533794556357L;

    public static final int UNKNOWN_POSITION = -1;

    private final ErrorCode errorCode;

    private final int vendorCode;

    private final int position;

    public PartGenRuntimeException(ErrorCode errorCode, String... params) {
        this(errorCode, UNKNOWN_POSITION, params);
    }

    public PartGenRuntimeException(ErrorCode errorCode, int position, String... params) {
        super(errorCode.getMessage(params));
        this.errorCode = errorCode;
        this.vendorCode = errorCode.getCode();
        this.position = position;
    }

    public PartGenRuntimeException(ErrorCode errorCode, Throwable cause, String... params) {
        super(errorCode.getMessage(params), cause);
        this.errorCode = errorCode;
        this.vendorCode = errorCode.getCode();
        this.position = UNKNOWN_POSITION;
    }

    private PartGenRuntimeException(PartGenRuntimeException e, int position) {
        super(e.getMessage(), e);
        this.errorCode = e.errorCode;
        this.vendorCode = e.vendorCode;
        this.position = position;
    }

    /**
     * This error located at {@code position}, or this error itself when it already carries a position.
     */
    public PartGenRuntimeException atPosition(int position) {
        if (hasPosition() || position < 0) {
            return this;
        }
        return new PartGenRuntimeException(this, position);
    }

    @Override
    public String toString() {
        return super.getLocalizedMessage();
    }

    public ErrorCode getErrorCodeType() {
        return errorCode;
    }

    public int getErrorCode() {
        return vendorCode;
    }

    public int getPosition() {
        return position;
    }

    public boolean hasPosition() {
        return position >= 0;
    }
}
