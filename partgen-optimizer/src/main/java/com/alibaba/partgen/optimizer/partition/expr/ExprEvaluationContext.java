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

package com.alibaba.partgen.optimizer.partition.expr;

import com.alibaba.partgen.common.utils.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Parameter slots of a compiled expression and the bookkeeping of its evaluations. Closed once by
 * the owner of the expression; evaluating through a closed context is an internal error.
 */
public class ExprEvaluationContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExprEvaluationContext.class);

    private final Object[] params;
    private long evaluationCount = 0;
    private boolean closed = false;

    public ExprEvaluationContext(int paramCount) {
        this.params = new Object[paramCount];
    }

    public void setParam(int index, Object value) {
        checkOpen();
        params[index] = value;
    }

    public Object getParam(int index) {
        checkOpen();
        return params[index];
    }

    void onEvaluated() {
        evaluationCount++;
    }

    private void checkOpen() {
        Assert.assertTrue(!closed, "expression evaluation context already released");
    }

    public long getEvaluationCount() {
        return evaluationCount;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        Arrays.fill(params, null);
        if (logger.isDebugEnabled()) {
            logger.debug("Released expression evaluation context after " + evaluationCount + " evaluation(s)");
        }
    }
}
