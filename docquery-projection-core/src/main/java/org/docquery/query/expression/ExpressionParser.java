/*
 * ExpressionParser.java
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
 * Parser entry point of the computed-expression language.
 */
@API(API.Status.EXPERIMENTAL)
@FunctionalInterface
public interface ExpressionParser {

    /**
     * Parse one operand, i.e. a field path, a variable reference, a literal or an operator document.
     *
     * @param context the context the resulting expression will report from {@link Expression#getExpressionContext()}
     * @param operand the operand in document form
     * @param variablesParseState the variables visible to the operand
     * @return the parsed expression
     * @throws ExpressionParseException if the operand is not a valid expression
     */
    @Nonnull
    Expression parseOperand(@Nonnull ExpressionContext context,
                            @Nonnull Value operand,
                            @Nonnull VariablesParseState variablesParseState);
}
