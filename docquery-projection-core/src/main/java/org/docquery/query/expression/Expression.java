/*
 * Expression.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2024 Apple Inc. and the FoundationDB project authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.docquery.query.expression;

import com.google.protobuf.Value;
import org.docquery.annotation.API;

import javax.annotation.Nonnull;

/**
 * A computed-expression tree, such as an arithmetic or string expression used to produce a field of a
 * projection's output. Expressions are immutable once parsed and may be shared between holders.
 *
 * <p>
 * There is no way to copy an expression directly. A copy is obtained by {@linkplain #serialize(boolean)
 * serializing} it and handing the result back to the {@link ExpressionParser} of its
 * {@linkplain #getExpressionContext() context}. Implementations are expected to make that round trip
 * lossless.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public interface Expression {

    /**
     * Render this expression in its document form.
     *
     * @param explain whether to produce the (possibly lossy) explain form instead of the parseable one
     * @return the expression as a document value
     */
    @Nonnull
    Value serialize(boolean explain);

    /**
     * Get the context this expression was parsed under.
     *
     * @return the parse context
     */
    @Nonnull
    ExpressionContext getExpressionContext();
}
