/*
 * ExpressionContext.java
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

import com.google.common.base.Preconditions;
import com.google.protobuf.Value;
import org.docquery.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * The context a computed expression is parsed under: the parser that understands its document form and
 * the variables that were in scope. Expressions keep a reference to their context so that they can be
 * parsed again with the same variable resolution, which is how they are copied.
 *
 * <p>
 * Use {@link #newBuilder()} to create one.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class ExpressionContext {
    @Nonnull
    private final ExpressionParser parser;
    @Nonnull
    private final VariablesParseState variablesParseState;

    private ExpressionContext(@Nonnull ExpressionParser parser, @Nonnull VariablesParseState variablesParseState) {
        this.parser = parser;
        this.variablesParseState = variablesParseState;
    }

    @Nonnull
    public ExpressionParser getParser() {
        return parser;
    }

    @Nonnull
    public VariablesParseState getVariablesParseState() {
        return variablesParseState;
    }

    /**
     * Parse an operand under this context and its variables.
     *
     * @param operand the operand in document form
     * @return the parsed expression
     * @throws ExpressionParseException if the operand is not a valid expression
     */
    @Nonnull
    public Expression parseOperand(@Nonnull Value operand) {
        return parser.parseOperand(this, operand, variablesParseState);
    }

    @Nonnull
    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ExpressionContext(" + variablesParseState + ")";
    }

    /**
     * Builder for {@link ExpressionContext}. A parser is required; the variables default to a fresh
     * {@link VariablesParseState} holding only the builtin variables.
     */
    public static class Builder {
        @Nullable
        private ExpressionParser parser;
        @Nullable
        private VariablesParseState variablesParseState;

        private Builder() {
        }

        @Nonnull
        public Builder setParser(@Nonnull ExpressionParser parser) {
            this.parser = parser;
            return this;
        }

        @Nonnull
        public Builder setVariablesParseState(@Nonnull VariablesParseState variablesParseState) {
            this.variablesParseState = variablesParseState;
            return this;
        }

        @Nonnull
        public ExpressionContext build() {
            Preconditions.checkState(parser != null, "expression context requires a parser");
            return new ExpressionContext(parser,
                    variablesParseState == null ? new VariablesParseState() : variablesParseState);
        }
    }
}
