/*
 * PathTrackingVisitorContext.java
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

import com.google.common.collect.ImmutableList;
import org.docquery.annotation.API;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * State shared between a {@link PathTrackingWalker} and the visitors it drives: the field path of the node
 * currently being visited, plus an arbitrary piece of data the visitors want to accumulate into.
 *
 * <p>
 * The path of a node is the sequence of field names on the way down from the walk's root, prefixed with an
 * optional base path. Only path nodes contribute field names, so the match predicate under an
 * {@code $elemMatch} has the same path as the {@code $elemMatch} itself.
 * </p>
 *
 * @param <T> the type of the visitors' data
 */
@API(API.Status.EXPERIMENTAL)
public class PathTrackingVisitorContext<T> {
    @Nonnull
    private final List<String> basePath;
    @Nonnull
    private final List<String> path = new ArrayList<>();
    @Nullable
    private final T data;

    public PathTrackingVisitorContext() {
        this(ImmutableList.of(), null);
    }

    public PathTrackingVisitorContext(@Nullable T data) {
        this(ImmutableList.of(), data);
    }

    public PathTrackingVisitorContext(@Nonnull List<String> basePath, @Nullable T data) {
        this.basePath = ImmutableList.copyOf(basePath);
        this.data = data;
    }

    /**
     * Get the full path of the node being visited, base path included.
     * @return the path components
     */
    @Nonnull
    public List<String> getFullPath() {
        return ImmutableList.<String>builderWithExpectedSize(basePath.size() + path.size())
                .addAll(basePath)
                .addAll(path)
                .build();
    }

    /**
     * Get the full path of the node being visited in dotted form.
     * @return the dotted path, empty at the top level
     */
    @Nonnull
    public String getFullPathString() {
        return String.join(".", getFullPath());
    }

    /**
     * Get the field name under which the node being visited appears.
     * @return the last path component, or {@code null} for the walk's root
     */
    @Nullable
    public String getFieldName() {
        return path.isEmpty() ? null : path.get(path.size() - 1);
    }

    /**
     * Get how many field names lie between the walk's root and the node being visited.
     * @return the depth, not counting the base path
     */
    public int getDepth() {
        return path.size();
    }

    @Nullable
    public T getData() {
        return data;
    }

    void pushFieldName(@Nonnull String fieldName) {
        path.add(fieldName);
    }

    void popFieldName() {
        path.remove(path.size() - 1);
    }
}
