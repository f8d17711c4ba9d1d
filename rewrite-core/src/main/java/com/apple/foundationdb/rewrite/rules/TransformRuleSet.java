/*
 * TransformRuleSet.java
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

package com.apple.foundationdb.rewrite.rules;

import com.apple.foundationdb.rewrite.InvalidTransformException;
import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered, immutable list of transforms. The optimizer applies them in this order, each exactly once.
 */
@API(API.Status.STABLE)
public class TransformRuleSet {
    /**
     * The transforms the optimizer uses unless configured otherwise: zero elimination on the left, then on the right.
     */
    @Nonnull
    public static final TransformRuleSet DEFAULT = new TransformRuleSet(ImmutableList.of(
            TransformRules.additionWithZeroOnLeft(),
            TransformRules.additionWithZeroOnRight()
    ));

    @Nonnull
    private final List<Transform> transforms;

    private TransformRuleSet(@Nonnull List<Transform> transforms) {
        final Set<String> names = new HashSet<>();
        for (Transform transform : transforms) {
            if (!names.add(transform.getName())) {
                throw new InvalidTransformException("transform name used more than once in rule set",
                        LogMessageKeys.TRANSFORM_NAME, transform.getName());
            }
        }
        this.transforms = ImmutableList.copyOf(transforms);
    }

    @Nonnull
    public static TransformRuleSet of(@Nonnull Transform... transforms) {
        return new TransformRuleSet(ImmutableList.copyOf(transforms));
    }

    @Nonnull
    public static TransformRuleSet of(@Nonnull List<Transform> transforms) {
        return new TransformRuleSet(transforms);
    }

    /**
     * Get the transforms in the order they are applied.
     * @return the transforms
     */
    @Nonnull
    public List<Transform> getTransforms() {
        return transforms;
    }

    @Nonnull
    public Optional<Transform> getTransform(@Nonnull String name) {
        return transforms.stream().filter(transform -> transform.getName().equals(name)).findFirst();
    }

    public boolean contains(@Nonnull String name) {
        return getTransform(name).isPresent();
    }

    public int size() {
        return transforms.size();
    }

    @Override
    public String toString() {
        return transforms.toString();
    }
}
