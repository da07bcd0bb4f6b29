/*
 * VariablesParseState.java
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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import org.docquery.annotation.API;
import org.docquery.logging.LogMessageKeys;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The variables in scope while parsing a computed expression. Each name maps to the id that the parsed
 * expression uses to refer to it. The builtin variables {@value #ROOT} and {@value #CURRENT} are always
 * defined and cannot be redefined. Defining a user variable a second time shadows the earlier definition
 * with a fresh id.
 *
 * <p>
 * Instances are mutable and not thread safe. A parse state is normally owned by an {@link ExpressionContext}
 * and only extended while that context is being set up.
 * </p>
 */
@API(API.Status.EXPERIMENTAL)
public class VariablesParseState {
    public static final String ROOT = "ROOT";
    public static final String CURRENT = "CURRENT";
    public static final int ROOT_ID = -1;
    public static final int CURRENT_ID = -2;

    @Nonnull
    private final Map<String, Integer> variables = new LinkedHashMap<>();
    private int nextId;

    public VariablesParseState() {
        variables.put(ROOT, ROOT_ID);
        variables.put(CURRENT, CURRENT_ID);
    }

    /**
     * Bring a user variable into scope.
     *
     * @param name the variable name
     * @return the id assigned to the variable
     */
    public int defineVariable(@Nonnull String name) {
        Preconditions.checkArgument(!name.isEmpty(), "variable name must not be empty");
        Preconditions.checkArgument(!isBuiltin(name), "cannot redefine builtin variable %s", name);
        final int id = nextId++;
        variables.put(name, id);
        return id;
    }

    /**
     * Resolve a variable name to its id.
     *
     * @param name the variable name
     * @return the id of the innermost definition of {@code name}
     * @throws ExpressionParseException if no variable of that name is in scope
     */
    public int getVariable(@Nonnull String name) {
        final Integer id = variables.get(name);
        if (id == null) {
            throw new ExpressionParseException("use of undefined variable", LogMessageKeys.VARIABLE_NAME, name);
        }
        return id;
    }

    public boolean isDefined(@Nonnull String name) {
        return variables.containsKey(name);
    }

    @Nonnull
    public Set<String> getDefinedVariables() {
        return ImmutableSet.copyOf(variables.keySet());
    }

    private static boolean isBuiltin(@Nonnull String name) {
        return ROOT.equals(name) || CURRENT.equals(name);
    }

    @Override
    public String toString() {
        return "VariablesParseState" + variables;
    }
}
