/*
 * ProjectionPathASTNode.java
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
import org.docquery.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A step in a field path. Each child is the sub-projection of the field whose name sits at the same
 * position in {@link #getFieldNames()}; the two lists always have the same length and order.
 *
 * <p>
 * Field names are not validated here. They are expected to be unique, but duplicates are not detected:
 * {@link #getChild(String)} simply returns the first match.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public final class ProjectionPathASTNode extends ASTNode {
    // names of the child nodes, same size as the children
    @Nonnull
    private final List<String> fieldNames;

    public ProjectionPathASTNode() {
        this.fieldNames = new ArrayList<>();
    }

    public ProjectionPathASTNode(@Nonnull List<? extends ASTNode> children, @Nonnull List<String> fieldNames) {
        super(verifyLockstep(children, fieldNames));
        this.fieldNames = new ArrayList<>(fieldNames);
    }

    private ProjectionPathASTNode(@Nonnull ProjectionPathASTNode other) {
        super(other);
        this.fieldNames = new ArrayList<>(other.fieldNames);
    }

    @Nonnull
    private static List<? extends ASTNode> verifyLockstep(@Nonnull List<? extends ASTNode> children,
                                                          @Nonnull List<String> fieldNames) {
        Verify.verify(children.size() == fieldNames.size(),
                "path node has %s children but %s field names", children.size(), fieldNames.size());
        for (String fieldName : fieldNames) {
            Verify.verifyNotNull(fieldName, "path node field name must not be null");
        }
        return children;
    }

    @Nonnull
    @Override
    public ProjectionPathASTNode clone() {
        return new ProjectionPathASTNode(this);
    }

    @Override
    public void acceptVisitor(@Nonnull ProjectionASTVisitor visitor) {
        visitor.visit(this);
    }

    /**
     * Find the sub-projection for a field.
     *
     * @param fieldName the field name to look up
     * @return the child paired with the first occurrence of {@code fieldName}, or {@code null} if there is none
     */
    @Nullable
    public ASTNode getChild(@Nonnull String fieldName) {
        final List<ASTNode> children = getChildren();
        Verify.verify(fieldNames.size() == children.size());
        for (int i = 0; i < fieldNames.size(); i++) {
            if (fieldNames.get(i).equals(fieldName)) {
                return children.get(i);
            }
        }
        return null;
    }

    /**
     * Append a sub-projection for a field, taking ownership of {@code node}.
     *
     * @param fieldName the field name
     * @param node the sub-projection, which must not have a parent yet
     */
    public void addChild(@Nonnull String fieldName, @Nonnull ASTNode node) {
        Verify.verifyNotNull(fieldName, "path node field name must not be null");
        addChildToInternalList(node);
        fieldNames.add(fieldName);
    }

    @Nonnull
    public List<String> getFieldNames() {
        return Collections.unmodifiableList(fieldNames);
    }

    @Override
    public String toString() {
        final List<ASTNode> children = getChildren();
        final StringBuilder sb = new StringBuilder("Path(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(fieldNames.get(i)).append(": ").append(children.get(i));
        }
        return sb.append(')').toString();
    }
}
