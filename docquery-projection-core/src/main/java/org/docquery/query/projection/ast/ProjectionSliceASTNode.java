/*
 * ProjectionSliceASTNode.java
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
import javax.annotation.Nullable;

/**
 * The {@code $slice} projection operator, which returns at most {@code limit} elements of an array after
 * optionally skipping {@code skip} of them. Either number may be negative, in which case it counts from
 * the end of the array.
 */
@API(API.Status.EXPERIMENTAL)
public final class ProjectionSliceASTNode extends ASTNode {
    @Nullable
    private final Integer skip;
    private final int limit;

    public ProjectionSliceASTNode(@Nullable Integer skip, int limit) {
        this.skip = skip;
        this.limit = limit;
    }

    private ProjectionSliceASTNode(@Nonnull ProjectionSliceASTNode other) {
        super(other);
        this.skip = other.skip;
        this.limit = other.limit;
    }

    @Nonnull
    @Override
    public ProjectionSliceASTNode clone() {
        return new ProjectionSliceASTNode(this);
    }

    @Override
    public void acceptVisitor(@Nonnull ProjectionASTVisitor visitor) {
        visitor.visit(this);
    }

    public int getLimit() {
        return limit;
    }

    /**
     * Get the number of elements to skip.
     * @return the skip, or {@code null} if the slice only has a limit
     */
    @Nullable
    public Integer getSkip() {
        return skip;
    }

    @Override
    public String toString() {
        return skip == null ? "Slice(limit=" + limit + ")" : "Slice(skip=" + skip + ", limit=" + limit + ")";
    }
}
