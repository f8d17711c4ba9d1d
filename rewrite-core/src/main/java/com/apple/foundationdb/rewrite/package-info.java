/*
 * package-info.java
 *
 * This source file is part of the FoundationDB open source project
 *
 * Copyright 2015-2026 Apple Inc. and the FoundationDB project authors
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
 * Pattern-based rewriting of arithmetic expression trees.
 *
 * <p>
 * The entry point is {@link com.apple.foundationdb.rewrite.ExpressionOptimizer}, which applies the ordered
 * transforms of its {@link com.apple.foundationdb.rewrite.OptimizerConfiguration} to a tree built from
 * {@link com.apple.foundationdb.rewrite.expressions.Expressions}. All failures are reported as subclasses of
 * {@link com.apple.foundationdb.rewrite.RewriteCoreException}.
 * </p>
 */
package com.apple.foundationdb.rewrite;
