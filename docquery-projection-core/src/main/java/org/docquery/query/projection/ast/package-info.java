/*
 * package-info.java
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

/**
 * Typed tree representation of a projection, the part of a query that decides which fields of a matching
 * document are returned.
 *
 * <p>
 * A tree is built bottom-up by the projection parser, then inspected by analysis passes through
 * {@link org.docquery.query.projection.ast.ProjectionASTVisitor}. Passes that need their own copy of a tree,
 * for instance to instantiate a cached template projection per query, call
 * {@link org.docquery.query.projection.ast.ASTNode#clone()}.
 * </p>
 */
package org.docquery.query.projection.ast;
