/*
 * PathTrackingWalker.java
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
import org.docquery.query.projection.ast.ProjectionPathASTNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * A {@link ProjectionASTWalker}-style traversal that keeps a {@link PathTrackingVisitorContext} pointing at
 * the field path of the node being visited. Visitors that need the path hold a reference to the same context.
 *
 * <pre>
 * PathTrackingVisitorContext&lt;Set&lt;String&gt;&gt; context = new PathTrackingVisitorContext&lt;&gt;(new HashSet&lt;&gt;());
 * PathTrackingWalker.walk(root, context, new IncludedPathsVisitor(context), null);
 * </pre>
 */
@API(API.Status.EXPERIMENTAL)
public final class PathTrackingWalker {

    private PathTrackingWalker() {
    }

    /**
     * Walk the subtree rooted at {@code root}, updating {@code context} as the walk moves between fields.
     *
     * @param root the node to start at
     * @param context the context to keep up to date
     * @param preVisitor visitor called on the way down, or {@code null}
     * @param postVisitor visitor called on the way up, or {@code null}
     */
    public static void walk(@Nonnull ASTNode root,
                            @Nonnull PathTrackingVisitorContext<?> context,
                            @Nullable ProjectionASTVisitor preVisitor,
                            @Nullable ProjectionASTVisitor postVisitor) {
        Preconditions.checkArgument(preVisitor != null || postVisitor != null,
                "walk requires a pre-visitor or a post-visitor");
        Preconditions.checkArgument(context.getDepth() == 0, "context is already in use by another walk");
        walkInternal(root, context, preVisitor, postVisitor);
    }

    private static void walkInternal(@Nonnull ASTNode node,
                                     @Nonnull PathTrackingVisitorContext<?> context,
                                     @Nullable ProjectionASTVisitor preVisitor,
                                     @Nullable ProjectionASTVisitor postVisitor) {
        if (preVisitor != null) {
            node.acceptVisitor(preVisitor);
        }
        final List<ASTNode> children = node.getChildren();
        final List<String> fieldNames = node instanceof ProjectionPathASTNode
                                        ? ((ProjectionPathASTNode)node).getFieldNames()
                                        : null;
        for (int i = 0; i < children.size(); i++) {
            if (fieldNames != null) {
                context.pushFieldName(fieldNames.get(i));
            }
            walkInternal(children.get(i), context, preVisitor, postVisitor);
            if (fieldNames != null) {
                context.popFieldName();
            }
        }
        if (postVisitor != null) {
            node.acceptVisitor(postVisitor);
        }
    }
}
