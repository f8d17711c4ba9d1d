/*
 * OptimizerConfiguration.java
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

package com.apple.foundationdb.rewrite;

import com.apple.foundationdb.rewrite.annotation.API;
import com.apple.foundationdb.rewrite.logging.LogMessageKeys;
import com.apple.foundationdb.rewrite.rules.Transform;
import com.apple.foundationdb.rewrite.rules.TransformRuleSet;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nonnull;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * A set of configuration options for the {@link ExpressionOptimizer}.
 */
@API(API.Status.UNSTABLE)
public class OptimizerConfiguration {
    @Nonnull
    private static final OptimizerConfiguration DEFAULT_CONFIGURATION = builder().build();

    @Nonnull
    private final TransformRuleSet ruleSet;
    @Nonnull
    private final Set<String> disabledTransforms;

    private OptimizerConfiguration(@Nonnull Builder builder) {
        this.ruleSet = builder.ruleSet;
        this.disabledTransforms = ImmutableSet.copyOf(builder.disabledTransforms);
    }

    /**
     * Get the transforms the optimizer applies, in order.
     * @return the rule set
     */
    @Nonnull
    public TransformRuleSet getRuleSet() {
        return ruleSet;
    }

    /**
     * Get the names of the transforms of the rule set that the optimizer skips.
     * @return the names of the disabled transforms
     */
    @Nonnull
    public Set<String> getDisabledTransforms() {
        return disabledTransforms;
    }

    public boolean isTransformEnabled(@Nonnull Transform transform) {
        return !disabledTransforms.contains(transform.getName());
    }

    @Nonnull
    public Builder toBuilder() {
        return new Builder(this);
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get the default configuration: {@link TransformRuleSet#DEFAULT} with nothing disabled.
     * @return the default configuration
     */
    @Nonnull
    public static OptimizerConfiguration defaultConfiguration() {
        return DEFAULT_CONFIGURATION;
    }

    @Override
    public String toString() {
        return "OptimizerConfiguration{ruleSet=" + ruleSet + ", disabledTransforms=" + disabledTransforms + "}";
    }

    /**
     * A builder for {@link OptimizerConfiguration}.
     */
    public static class Builder {
        @Nonnull
        private TransformRuleSet ruleSet = TransformRuleSet.DEFAULT;
        @Nonnull
        private final Set<String> disabledTransforms = new HashSet<>();

        private Builder() {
        }

        private Builder(@Nonnull OptimizerConfiguration configuration) {
            this.ruleSet = configuration.ruleSet;
            this.disabledTransforms.addAll(configuration.disabledTransforms);
        }

        @Nonnull
        public Builder setRuleSet(@Nonnull TransformRuleSet ruleSet) {
            this.ruleSet = ruleSet;
            return this;
        }

        /**
         * Skip the transform with the given name.
         * @param transformName the name of a transform of the rule set
         * @return this builder
         */
        @Nonnull
        public Builder disableTransform(@Nonnull String transformName) {
            disabledTransforms.add(transformName);
            return this;
        }

        @Nonnull
        public Builder disableTransforms(@Nonnull Collection<String> transformNames) {
            disabledTransforms.addAll(transformNames);
            return this;
        }

        @Nonnull
        public Builder enableTransform(@Nonnull String transformName) {
            disabledTransforms.remove(transformName);
            return this;
        }

        /**
         * Build the configuration.
         * @return the configuration
         * @throws InvalidTransformException if a disabled transform is not part of the rule set
         */
        @Nonnull
        public OptimizerConfiguration build() {
            for (String transformName : disabledTransforms) {
                if (!ruleSet.contains(transformName)) {
                    throw new InvalidTransformException("disabled transform is not part of the rule set",
                            LogMessageKeys.TRANSFORM_NAME, transformName,
                            LogMessageKeys.RULE_SET, ruleSet);
                }
            }
            return new OptimizerConfiguration(this);
        }
    }
}
