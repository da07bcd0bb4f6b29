/*
 * ProjectionASTDebugSerializerTest.java
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

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import org.docquery.query.expression.TestExpressions;
import org.docquery.query.projection.ast.BooleanConstantASTNode;
import org.docquery.query.projection.ast.ProjectionElemMatchASTNode;
import org.docquery.query.projection.ast.ProjectionPathASTNode;
import org.docquery.query.projection.ast.ProjectionSliceASTNode;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;

import static org.docquery.query.projection.ast.ProjectionASTTestUtils.equalityNode;
import static org.docquery.query.projection.ast.ProjectionASTTestUtils.path;
import static org.docquery.query.projection.ast.ProjectionASTTestUtils.sampleTree;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ProjectionASTDebugSerializer}.
 */
public class ProjectionASTDebugSerializerTest {

    @Nonnull
    private static Struct field(@Nonnull Value value, @Nonnull String name) {
        return value.getStructValue().getFieldsOrThrow(name).getStructValue();
    }

    @Test
    public void serializesEveryKind() {
        final Value serialized = ProjectionASTDebugSerializer.serialize(sampleTree(TestExpressions.newContext()));
        final Struct root = serialized.getStructValue();
        assertThat(root.getFieldsMap().keySet(), containsInAnyOrder("a", "b", "e", "f.$", "g", "h"));

        assertTrue(root.getFieldsOrThrow("a").getBoolValue());

        final Struct b = field(serialized, "b");
        assertEquals(Value.newBuilder().setBoolValue(false).build(), b.getFieldsOrThrow("c"));
        final Value slice = b.getFieldsOrThrow("d").getStructValue().getFieldsOrThrow(ProjectionASTDebugSerializer.SLICE);
        assertEquals(2.0, slice.getListValue().getValues(0).getNumberValue());
        assertEquals(5.0, slice.getListValue().getValues(1).getNumberValue());

        final Value elemMatch = field(serialized, "e").getFieldsOrThrow(ProjectionASTDebugSerializer.ELEM_MATCH);
        assertEquals(equalityNode("x", "1").getMatchExpression().serialize(), elemMatch);

        assertEquals(equalityNode("y", "2").getMatchExpression().serialize(), root.getFieldsOrThrow("f.$"));

        final Value constant = Value.newBuilder()
                .setStructValue(Struct.newBuilder().putFields("$const", TestExpressions.number(1)))
                .build();
        assertEquals(TestExpressions.operator("$add", TestExpressions.string("$a"), constant), root.getFieldsOrThrow("g"));

        assertEquals(3.0, field(serialized, "h").getFieldsOrThrow(ProjectionASTDebugSerializer.SLICE).getNumberValue());
    }

    @Test
    public void serializesSubtrees() {
        assertEquals(Value.newBuilder().setBoolValue(true).build(),
                ProjectionASTDebugSerializer.serialize(new BooleanConstantASTNode(true)));
        final Value elemMatch = ProjectionASTDebugSerializer.serialize(new ProjectionElemMatchASTNode(equalityNode("q", "v")));
        assertTrue(elemMatch.getStructValue().containsFields(ProjectionASTDebugSerializer.ELEM_MATCH));
        assertEquals(Value.newBuilder().setStructValue(Struct.getDefaultInstance()).build(),
                ProjectionASTDebugSerializer.serialize(new ProjectionPathASTNode()));
    }

    @Test
    public void lastDuplicateFieldWins() {
        final Value serialized = ProjectionASTDebugSerializer.serialize(path(
                "a", new BooleanConstantASTNode(true),
                "a", new ProjectionSliceASTNode(null, 2)));
        assertEquals(1, serialized.getStructValue().getFieldsCount());
        assertEquals(2.0, field(serialized, "a").getFieldsOrThrow(ProjectionASTDebugSerializer.SLICE).getNumberValue());
    }
}
