/*
 * TestMatchExpressions.java
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

import com.google.common.collect.ImmutableList;
import com.google.protobuf.ByteString;
import com.google.protobuf.ListValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;

import javax.annotation.Nonnull;
import java.util.List;

/**
 * A tiny match language for tests. Operands are kept as views into the document they were parsed from,
 * the way a real predicate tree refers into its backing buffer.
 */
public final class TestMatchExpressions {

    private TestMatchExpressions() {
    }

    /**
     * Parse {@code path=value} out of a document whose bytes are exactly that text.
     * @param document the backing document
     * @return an equality predicate whose operand shares {@code document}'s bytes
     */
    @Nonnull
    public static Equality parseEquality(@Nonnull ByteString document) {
        final String text = document.toStringUtf8();
        final int separator = text.indexOf('=');
        if (separator < 0) {
            throw new IllegalArgumentException("not an equality: " + text);
        }
        return new Equality(text.substring(0, separator), document.substring(separator + 1));
    }

    /**
     * {@code {path: {$eq: operand}}}.
     */
    public static class Equality implements MatchExpression {
        @Nonnull
        private final String path;
        @Nonnull
        private final ByteString operand;

        public Equality(@Nonnull String path, @Nonnull ByteString operand) {
            this.path = path;
            this.operand = operand;
        }

        @Nonnull
        public String getPath() {
            return path;
        }

        @Nonnull
        public ByteString getOperand() {
            return operand;
        }

        @Nonnull
        @Override
        public Equality shallowClone() {
            return new Equality(path, operand);
        }

        @Nonnull
        @Override
        public Value serialize() {
            final Value eq = Value.newBuilder()
                    .setStructValue(Struct.newBuilder()
                            .putFields("$eq", Value.newBuilder().setStringValue(operand.toStringUtf8()).build()))
                    .build();
            return Value.newBuilder().setStructValue(Struct.newBuilder().putFields(path, eq)).build();
        }

        @Override
        public String toString() {
            return path + " == " + operand.toStringUtf8();
        }
    }

    /**
     * {@code {$and: [children...]}}.
     */
    public static class And implements MatchExpression {
        @Nonnull
        private final List<MatchExpression> children;

        public And(@Nonnull List<MatchExpression> children) {
            this.children = ImmutableList.copyOf(children);
        }

        @Nonnull
        public List<MatchExpression> getChildren() {
            return children;
        }

        @Nonnull
        @Override
        public And shallowClone() {
            return new And(children.stream().map(MatchExpression::shallowClone).collect(ImmutableList.toImmutableList()));
        }

        @Nonnull
        @Override
        public Value serialize() {
            final ListValue.Builder list = ListValue.newBuilder();
            children.forEach(child -> list.addValues(child.serialize()));
            return Value.newBuilder()
                    .setStructValue(Struct.newBuilder().putFields("$and", Value.newBuilder().setListValue(list).build()))
                    .build();
        }

        @Override
        public String toString() {
            return "And" + children;
        }
    }
}
