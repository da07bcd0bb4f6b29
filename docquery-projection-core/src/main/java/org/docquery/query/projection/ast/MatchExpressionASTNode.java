/*
 * MatchExpressionASTNode.java
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
import com.google.protobuf.ByteString;
import org.docquery.annotation.API;
import org.docquery.query.matcher.MatchExpression;

import javax.annotation.Nonnull;

/**
 * A leaf holding an embedded match predicate, such as the condition of an {@code $elemMatch} or of a
 * positional projection.
 *
 * <p>
 * The predicate may point into the bytes of the document it was parsed from, so the node keeps that
 * document alongside it. Since a {@link ByteString} is immutable, a clone shares the same buffer and only
 * {@linkplain MatchExpression#shallowClone() shallow-clones} the predicate; that is as good as a deep copy
 * for anyone reading either tree.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class MatchExpressionASTNode extends ASTNode {
    // must be kept with the predicate, which may refer into it
    @Nonnull
    private final ByteString document;
    @Nonnull
    private final MatchExpression matchExpression;

    public MatchExpressionASTNode(@Nonnull ByteString document, @Nonnull MatchExpression matchExpression) {
        this.document = Verify.verifyNotNull(document, "match expression node requires its backing document");
        this.matchExpression = Verify.verifyNotNull(matchExpression, "match expression node requires a predicate");
    }

    private MatchExpressionASTNode(@Nonnull MatchExpressionASTNode other) {
        super(other);
        this.document = other.document;
        this.matchExpression = other.matchExpression.shallowClone();
    }

    @Nonnull
    @Override
    public MatchExpressionASTNode clone() {
        return new MatchExpressionASTNode(this);
    }

    @Override
    public void acceptVisitor(@Nonnull ProjectionASTVisitor visitor) {
        visitor.visit(this);
    }

    @Nonnull
    public MatchExpression getMatchExpression() {
        return matchExpression;
    }

    /**
     * Get the document the predicate was parsed from.
     * @return the backing document
     */
    @Nonnull
    public ByteString getDocument() {
        return document;
    }

    @Override
    public String toString() {
        return "Match(" + matchExpression + ")";
    }
}
