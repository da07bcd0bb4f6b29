/*
 * ASTNode.java
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
 * A node of the tree representation of a projection. The tree offers a typed, walkable form of a projection
 * for validation and dependency analysis. It is not designed for executing a projection.
 *
 * <p>
 * A node owns its children. A child is adopted exactly once, at which point its parent link is set, and the
 * link never changes afterwards. Adopting a {@code null} child, a node that already has a parent, or an
 * ancestor of the adopting node breaks the tree's structure and fails with a
 * {@link com.google.common.base.VerifyException}.
 * </p>
 *
 * <p>
 * The set of node kinds is closed: every subclass lives in this package and is {@code final}, and
 * {@link ProjectionASTVisitor} has one method per kind.
 * </p>
 *
 * <p>
 * Trees are not thread safe. A tree must not be modified while it is being walked or cloned.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public abstract class ASTNode {
    @Nonnull
    private final List<ASTNode> children;
    // null if this is the root
    @Nullable
    private ASTNode parent;

    ASTNode() {
        this.children = new ArrayList<>();
    }

    ASTNode(@Nonnull List<? extends ASTNode> children) {
        this.children = new ArrayList<>(children.size());
        for (ASTNode child : children) {
            addChildToInternalList(child);
        }
    }

    /**
     * Copy constructor used by {@link #clone()}. Children are cloned and adopted by the new node. The new node
     * itself starts out as a root; whoever adopts it sets its parent.
     *
     * @param other the node to copy
     */
    ASTNode(@Nonnull ASTNode other) {
        this.children = new ArrayList<>(other.children.size());
        for (ASTNode child : other.children) {
            addChildToInternalList(child.clone());
        }
    }

    /**
     * Create a deep copy of the subtree rooted at this node. The copy is a root and shares no mutable state
     * with this tree.
     *
     * @return the root of the copied subtree
     * @throws ProjectionCloneException if an embedded computed expression cannot be copied
     */
    @Nonnull
    @Override
    public abstract ASTNode clone();

    /**
     * Present this node to the given visitor by calling the visitor method for this node's kind. Children
     * are not visited; traversal order is up to the visitor.
     *
     * @param visitor the visitor
     */
    public abstract void acceptVisitor(@Nonnull ProjectionASTVisitor visitor);

    @Nonnull
    public List<ASTNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Nullable
    public ASTNode getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    void addChildToInternalList(@Nullable ASTNode node) {
        Verify.verifyNotNull(node, "projection node child must not be null");
        Verify.verify(node.parent == null, "projection node %s already has a parent", node);
        for (ASTNode ancestor = this; ancestor != null; ancestor = ancestor.parent) {
            Verify.verify(ancestor != node, "projection node %s cannot adopt its own ancestor", this);
        }
        node.parent = this;
        children.add(node);
    }
}
