/*
 * ProjectionElemMatchASTNode.java
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

import org.docquery.annotation.API;

import javax.annotation.Nonnull;

/**
 * The {@code $elemMatch} projection operator. Its only child is the predicate an array element has to
 * satisfy to be returned.
 */
@API(API.Status.EXPERIMENTAL)
public final class ProjectionElemMatchASTNode extends ASTNode {

    public ProjectionElemMatchASTNode(@Nonnull MatchExpressionASTNode child) {
        addChildToInternalList(child);
    }

    private ProjectionElemMatchASTNode(@Nonnull ProjectionElemMatchASTNode other) {
        super(other);
    }

    @Nonnull
    @Override
    public ProjectionElemMatchASTNode clone() {
        return new ProjectionElemMatchASTNode(this);
    }

    @Override
    public void acceptVisitor(@Nonnull ProjectionASTVisitor visitor) {
        visitor.visit(this);
    }

    @Nonnull
    public MatchExpressionASTNode getMatchExpressionNode() {
        return (MatchExpressionASTNode)getChildren().get(0);
    }

    @Override
    public String toString() {
        return "ElemMatch(" + getMatchExpressionNode() + ")";
    }
}
