/*
 * ProjectionPositionalASTNode.java
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
 * The positional projection operator, as in {@code {"arr.$": 1}}. Its only child is the match predicate
 * that selects which array element is returned.
 */
@API(API.Status.EXPERIMENTAL)
public final class ProjectionPositionalASTNode extends ASTNode {

    public ProjectionPositionalASTNode(@Nonnull MatchExpressionASTNode child) {
        addChildToInternalList(child);
    }

    private ProjectionPositionalASTNode(@Nonnull ProjectionPositionalASTNode other) {
        super(other);
    }

    @Nonnull
    @Override
    public ProjectionPositionalASTNode clone() {
        return new ProjectionPositionalASTNode(this);
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
        return "Positional(" + getMatchExpressionNode() + ")";
    }
}
