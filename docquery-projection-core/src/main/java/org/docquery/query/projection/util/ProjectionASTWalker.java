/*
 * ProjectionASTWalker.java
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

package org.docquery.query.projection.util;

import com.google.common.base.Preconditions;
import org.docquery.annotation.API;
import org.docquery.query.projection.ast.ASTNode;
import org.docquery.query.projection.ast.ProjectionASTVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Depth-first traversal of a projection tree. Each node is presented to the pre-visitor before any of its
 * children and to the post-visitor after all of them. Children are visited in order.
 *
 * <p>
 * The tree must not be modified while it is being walked.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class ProjectionASTWalker {

    private ProjectionASTWalker() {
    }

    /**
     * Walk the subtree rooted at {@code root}.
     *
     * @param root the node to start at
     * @param preVisitor visitor called on the way down, or {@code null}
     * @param postVisitor visitor called on the way up, or {@code null}
     */
    public static void walk(@Nonnull ASTNode root,
                            @Nullable ProjectionASTVisitor preVisitor,
                            @Nullable ProjectionASTVisitor postVisitor) {
        Preconditions.checkArgument(preVisitor != null || postVisitor != null,
                "walk requires a pre-visitor or a post-visitor");
        walkInternal(root, preVisitor, postVisitor);
    }

    private static void walkInternal(@Nonnull ASTNode node,
                                     @Nullable ProjectionASTVisitor preVisitor,
                                     @Nullable ProjectionASTVisitor postVisitor) {
        if (preVisitor != null) {
            node.acceptVisitor(preVisitor);
        }
        for (ASTNode child : node.getChildren()) {
            walkInternal(child, preVisitor, postVisitor);
        }
        if (postVisitor != null) {
            node.acceptVisitor(postVisitor);
        }
    }
}
