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
package org.dependencytrack.compliance.evaluator.definition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.dependencytrack.compliance.evaluator.Rule;
import org.dependencytrack.compliance.evaluator.Violation;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A single rule, as it appears in a rule definitions document.
 * <p>
 * The condition is kept as a tree of {@link JsonNode}s, and compiled by {@link RuleDefinitionLoader}.
 *
 * @since 1.0.0
 */
record RuleDefinition(
        String name,
        Violation.Severity severity,
        Rule.Polarity polarity,
        @Nullable List<String> views,
        @JsonProperty("per_license") @Nullable Boolean perLicense,
        String message,
        @JsonProperty("how_to_fix") @Nullable String howToFix,
        JsonNode condition) {
}
