/*
 * ExpressionASTNode.java
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

package org.docquery.query.projection.ast;

import com.google.common.base.Verify;
import com.google.protobuf.TextFormat;
import com.google.protobuf.Value;
import org.docquery.annotation.API;
import org.docquery.logging.KeyValueLogMessage;
import org.docquery.logging.LogMessageKeys;
import org.docquery.query.expression.Expression;
import org.docquery.query.expression.ExpressionContext;
import org.docquery.query.expression.ExpressionParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * A computed field, whose value is produced by a computed {@link Expression}.
 *
 * <p>
 * Expressions cannot be copied directly, so cloning this node serializes the expression and parses the
 * result again under the original {@link ExpressionContext}, with the same variables in scope. This relies
 * on serializing and parsing being inverse operations for every expression; if parsing fails the clone
 * fails with a {@link ProjectionCloneException}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class ExpressionASTNode extends ASTNode {
    private static final Logger LOGGER = LoggerFactory.getLogger(ExpressionASTNode.class);

    @Nonnull
    private final Expression expression;

    public ExpressionASTNode(@Nonnull Expression expression) {
        this.expression = Verify.verifyNotNull(expression, "expression node requires an expression");
    }

    private ExpressionASTNode(@Nonnull ExpressionASTNode other) {
        super(other);
        this.expression = reparse(other.expression);
    }

    @Nonnull
    private static Expression reparse(@Nonnull Expression original) {
        final ExpressionContext context = original.getExpressionContext();
        final Value serialized = original.serialize(false);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(KeyValueLogMessage.of("copying expression by parsing its serialized form",
                    LogMessageKeys.SERIALIZED_EXPRESSION, TextFormat.printer().shortDebugString(serialized)));
        }
        try {
            return context.parseOperand(serialized);
        } catch (ExpressionParseException e) {
            throw new ProjectionCloneException("unable to parse serialized expression", e)
                    .addLogInfo(LogMessageKeys.NODE_TYPE, ExpressionASTNode.class.getSimpleName(),
                            LogMessageKeys.SERIALIZED_EXPRESSION, TextFormat.printer().shortDebugString(serialized));
        }
    }

    @Nonnull
    @Override
    public ExpressionASTNode clone() {
        return new ExpressionASTNode(this);
    }

    @Override
    public void acceptVisitor(@Nonnull ProjectionASTVisitor visitor) {
        visitor.visit(this);
    }

    @Nonnull
    public Expression getExpression() {
        return expression;
    }

    @Override
    public String toString() {
        return "Expression(" + TextFormat.printer().shortDebugString(expression.serialize(true)) + ")";
    }
}
