/*
 * BooleanConstantASTNode.java
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
 * An explicit inclusion ({@code true}) or exclusion ({@code false}) of a field.
 */
@API(API.Status.EXPERIMENTAL)
public final class BooleanConstantASTNode extends ASTNode {
    private final boolean value;

    public BooleanConstantASTNode(boolean value) {
        this.value = value;
    }

    private BooleanConstantASTNode(@Nonnull BooleanConstantASTNode other) {
        super(other);
        this.value = other.value;
    }

    @Nonnull
    @Override
    public BooleanConstantASTNode clone() {
        return new BooleanConstantASTNode(this);
    }

    @Override
    public void acceptVisitor(@Nonnull ProjectionASTVisitor visitor) {
        visitor.visit(this);
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
