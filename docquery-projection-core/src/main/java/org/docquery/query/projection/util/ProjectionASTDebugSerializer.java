/*
 * ProjectionASTDebugSerializer.java
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

import com.google.common.base.Verify;
import com.google.protobuf.ListValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import org.docquery.annotation.API;
import org.docquery.query.projection.ast.ASTNode;
import org.docquery.query.projection.ast.BooleanConstantASTNode;
import org.docquery.query.projection.ast.ExpressionASTNode;
import org.docquery.query.projection.ast.MatchExpressionASTNode;
import org.docquery.query.projection.ast.ProjectionASTVisitor;
import org.docquery.query.projection.ast.ProjectionElemMatchASTNode;
import org.docquery.query.projection.ast.ProjectionPathASTNode;
import org.docquery.query.projection.ast.ProjectionPositionalASTNode;
import org.docquery.query.projection.ast.ProjectionSliceASTNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Renders a projection tree back into document form, for logging and for comparing trees in tests. The
 * output mirrors the projection syntax:
 *
 * <pre>
 * {
 *   "a": true,
 *   "b": { "c": false },
 *   "d": { "$slice": [2, 5] },
 *   "e": { "$elemMatch": &lt;predicate&gt; },
 *   "f.$": &lt;predicate&gt;,
 *   "g": &lt;expression&gt;
 * }
 * </pre>
 *
 * <p>
 * Predicates and expressions are rendered by their own {@code serialize} methods. If a path node holds the
 * same field name twice, only the last sub-projection appears in the output.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class ProjectionASTDebugSerializer implements ProjectionASTVisitor {
    public static final String SLICE = "$slice";
    public static final String ELEM_MATCH = "$elemMatch";
    public static final String POSITIONAL_SUFFIX = ".$";

    @Nullable
    private Value result;

    private ProjectionASTDebugSerializer() {
    }

    /**
     * Render the subtree rooted at {@code node}.
     *
     * @param node the subtree
     * @return the document form of the subtree
     */
    @Nonnull
    public static Value serialize(@Nonnull ASTNode node) {
        return new ProjectionASTDebugSerializer().serializeNode(node);
    }

    @Nonnull
    private Value serializeNode(@Nonnull ASTNode node) {
        result = null;
        node.acceptVisitor(this);
        return Verify.verifyNotNull(result);
    }

    @Nonnull
    private static Value singleField(@Nonnull String fieldName, @Nonnull Value value) {
        return Value.newBuilder()
                .setStructValue(Struct.newBuilder().putFields(fieldName, value))
                .build();
    }

    @Nonnull
    private static Value number(int n) {
        return Value.newBuilder().setNumberValue(n).build();
    }

    @Override
    public void visit(@Nonnull MatchExpressionASTNode node) {
        result = node.getMatchExpression().serialize();
    }

    @Override
    public void visit(@Nonnull ProjectionPathASTNode node) {
        final Struct.Builder builder = Struct.newBuilder();
        final List<String> fieldNames = node.getFieldNames();
        final List<ASTNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            final ASTNode child = children.get(i);
            final String fieldName = child instanceof ProjectionPositionalASTNode
                                     ? fieldNames.get(i) + POSITIONAL_SUFFIX
                                     : fieldNames.get(i);
            builder.putFields(fieldName, serializeNode(child));
        }
        result = Value.newBuilder().setStructValue(builder).build();
    }

    @Override
    public void visit(@Nonnull ProjectionPositionalASTNode node) {
        result = serializeNode(node.getMatchExpressionNode());
    }

    @Override
    public void visit(@Nonnull ProjectionSliceASTNode node) {
        final Integer skip = node.getSkip();
        if (skip == null) {
            result = singleField(SLICE, number(node.getLimit()));
        } else {
            result = singleField(SLICE, Value.newBuilder()
                    .setListValue(ListValue.newBuilder()
                            .addValues(number(skip))
                            .addValues(number(node.getLimit())))
                    .build());
        }
    }

    @Override
    public void visit(@Nonnull ProjectionElemMatchASTNode node) {
        result = singleField(ELEM_MATCH, serializeNode(node.getMatchExpressionNode()));
    }

    @Override
    public void visit(@Nonnull ExpressionASTNode node) {
        result = node.getExpression().serialize(false);
    }

    @Override
    public void visit(@Nonnull BooleanConstantASTNode node) {
        result = Value.newBuilder().setBoolValue(node.getValue()).build();
    }
}
