/*
 * VariablesParseStateTest.java
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

import org.docquery.logging.LogMessageKeys;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasEntry;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link VariablesParseState}.
 */
public class VariablesParseStateTest {

    @Test
    public void builtinsAreAlwaysDefined() {
        final VariablesParseState variables = new VariablesParseState();
        assertEquals(VariablesParseState.ROOT_ID, variables.getVariable(VariablesParseState.ROOT));
        assertEquals(VariablesParseState.CURRENT_ID, variables.getVariable(VariablesParseState.CURRENT));
        assertThat(variables.getDefinedVariables(), contains(VariablesParseState.ROOT, VariablesParseState.CURRENT));
        assertThrows(IllegalArgumentException.class, () -> variables.defineVariable(VariablesParseState.ROOT));
    }

    @Test
    public void redefinitionShadows() {
        final VariablesParseState variables = new VariablesParseState();
        final int first = variables.defineVariable("x");
        final int second = variables.defineVariable("x");
        assertNotEquals(first, second);
        assertEquals(second, variables.getVariable("x"));
        assertTrue(variables.isDefined("x"));
    }

    @Test
    public void undefinedVariableFailsToResolve() {
        final VariablesParseState variables = new VariablesParseState();
        assertFalse(variables.isDefined("missing"));
        final ExpressionParseException e = assertThrows(ExpressionParseException.class, () -> variables.getVariable("missing"));
        assertThat(e.getLogInfo(), hasEntry(LogMessageKeys.VARIABLE_NAME.toString(), (Object)"missing"));
    }

    @Test
    public void emptyNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new VariablesParseState().defineVariable(""));
    }
}
