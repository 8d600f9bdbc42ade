/*
 * This file is part of Dependency-Track.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (c) OWASP Foundation. All Rights Reserved.
 */
package org.dependencytrack.compliance.evaluator;

import org.dependencytrack.compliance.model.Identifier;
import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Records that a {@link Rule} could not be evaluated for a single node of a dependency tree.
 *
 * @since 1.0.0
 */
public record EvaluationFailure(
        String ruleName,
        Identifier packageId,
        @Nullable Identifier projectId,
        String scopeName,
        int level,
        String reason) {

    public EvaluationFailure {
        requireNonNull(ruleName, "ruleName must not be null");
        requireNonNull(packageId, "packageId must not be null");
        requireNonNull(scopeName, "scopeName must not be null");
        requireNonNull(reason, "reason must not be null");
    }

}
