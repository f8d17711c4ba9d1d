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
 * The arithmetic expression tree model.
 *
 * <p>
 * Trees are made of {@link com.apple.foundationdb.rewrite.expressions.NumericConstantExpression numeric leaves} and
 * {@link com.apple.foundationdb.rewrite.expressions.BinaryAdditionExpression additions}. The same classes describe
 * transform patterns, where numeric leaves may be the {@link com.apple.foundationdb.rewrite.expressions.Numeric#ANY}
 * placeholder and any node may carry a binding name. Use
 * {@link com.apple.foundationdb.rewrite.expressions.Expressions} to build them.
 * </p>
 */
package com.apple.foundationdb.rewrite.expressions;
