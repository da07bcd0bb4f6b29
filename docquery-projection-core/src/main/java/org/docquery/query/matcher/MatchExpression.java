/*
 * MatchExpression.java
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

package org.docquery.query.matcher;

import com.google.protobuf.Value;
import org.docquery.annotation.API;

import javax.annotation.Nonnull;

/**
 * A predicate tree from the match language, as produced by its parser. Projections embed these for
 * positional ({@code $}) and {@code $elemMatch} array filtering.
 *
 * <p>
 * Implementations are free to keep references into the document buffer they were parsed from (for
 * example {@link com.google.protobuf.ByteString#substring(int, int)} views of literal values) rather
 * than copying the bytes out. Whoever holds a {@code MatchExpression} is therefore responsible for
 * keeping that buffer reachable for as long as the expression is in use.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public interface MatchExpression {

    /**
     * Copy the predicate tree without copying the buffer data it refers to. Every node of the tree is
     * duplicated, so the copy can be modified independently, but literal values and field names keep
     * pointing into the same backing buffer as this expression.
     *
     * @return a new predicate tree equivalent to this one
     */
    @Nonnull
    MatchExpression shallowClone();

    /**
     * Render this predicate in its document form.
     *
     * @return the predicate as a document value
     */
    @Nonnull
    Value serialize();
}
