/*
 * ExpressionContextTest.java
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

package org.docquery.query.expression;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ExpressionContext}.
 */
public class ExpressionContextTest {

    @Test
    public void parserIsRequired() {
        assertThrows(IllegalStateException.class, () -> ExpressionContext.newBuilder().build());
    }

    @Test
    public void defaultsToBuiltinVariables() {
        final ExpressionContext context = TestExpressions.newContext();
        assertTrue(context.getVariablesParseState().isDefined(VariablesParseState.ROOT));
        assertEquals(2, context.getVariablesParseState().getDefinedVariables().size());
    }

    @Test
    public void parsesWithItsOwnVariables() {
        final VariablesParseState variables = new VariablesParseState();
        final int id = variables.defineVariable("v");
        final ExpressionContext context = ExpressionContext.newBuilder()
                .setParser(TestExpressions.PARSER)
                .setVariablesParseState(variables)
                .build();
        assertThat(context.getParser(), sameInstance(TestExpressions.PARSER));
        assertThat(context.getVariablesParseState(), sameInstance(variables));
        final Expression expression = context.parseOperand(TestExpressions.string("$$v"));
        assertThat(expression, instanceOf(TestExpressions.Variable.class));
        assertEquals(id, ((TestExpressions.Variable)expression).getId());
        assertThat(expression.getExpressionContext(), sameInstance(context));

        assertThrows(ExpressionParseException.class, () -> TestExpressions.newContext().parseOperand(TestExpressions.string("$$v")));
    }
}
