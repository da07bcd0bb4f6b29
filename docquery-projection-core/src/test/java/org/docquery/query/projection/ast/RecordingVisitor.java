/*
 * RecordingVisitor.java
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

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;

/**
 * Records which overload was called for which node.
 */
public class RecordingVisitor implements ProjectionASTVisitor {
    @Nonnull
    private final List<String> overloads = new ArrayList<>();
    @Nonnull
    private final List<ASTNode> nodes = new ArrayList<>();

    @Nonnull
    public List<String> getOverloads() {
        return overloads;
    }

    @Nonnull
    public List<ASTNode> getNodes() {
        return nodes;
    }

    private void record(@Nonnull String overload, @Nonnull ASTNode node) {
        overloads.add(overload);
        nodes.add(node);
    }

    @Override
    public void visit(@Nonnull MatchExpressionASTNode node) {
        record("match", node);
    }

    @Override
    public void visit(@Nonnull ProjectionPathASTNode node) {
        record("path", node);
    }

    @Override
    public void visit(@Nonnull ProjectionPositionalASTNode node) {
        record("positional", node);
    }

    @Override
    public void visit(@Nonnull ProjectionSliceASTNode node) {
        record("slice", node);
    }

    @Override
    public void visit(@Nonnull ProjectionElemMatchASTNode node) {
        record("elemMatch", node);
    }

    @Override
    public void visit(@Nonnull ExpressionASTNode node) {
        record("expression", node);
    }

    @Override
    public void visit(@Nonnull BooleanConstantASTNode node) {
        record("boolean", node);
    }
}
