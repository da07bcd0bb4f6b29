/*
 * ProjectionASTVisitor.java
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
 * Visitor over the projection tree, with one method per node kind. A node's
 * {@link ASTNode#acceptVisitor(ProjectionASTVisitor)} calls the overload for its own class.
 *
 * <p>
 * There are no default implementations: a pass has to say what it does for every kind of node, so adding a
 * node kind breaks every pass that does not handle it yet. Visiting a node does not visit its children;
 * passes recurse through {@link ASTNode#getChildren()} themselves or use a walker from
 * {@code org.docquery.query.projection.util}.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public interface ProjectionASTVisitor {
    void visit(@Nonnull MatchExpressionASTNode node);

    void visit(@Nonnull ProjectionPathASTNode node);

    void visit(@Nonnull ProjectionPositionalASTNode node);

    void visit(@Nonnull ProjectionSliceASTNode node);

    void visit(@Nonnull ProjectionElemMatchASTNode node);

    void visit(@Nonnull ExpressionASTNode node);

    void visit(@Nonnull BooleanConstantASTNode node);
}
