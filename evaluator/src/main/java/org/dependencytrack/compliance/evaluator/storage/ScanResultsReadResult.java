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
package org.dependencytrack.compliance.evaluator.storage;

import org.dependencytrack.compliance.model.LicenseFinding;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Result of a {@link ScanResultsStorage#read(org.dependencytrack.compliance.model.Identifier)} operation.
 *
 * @since 1.0.0
 */
public sealed interface ScanResultsReadResult {

    /**
     * @param findings The license findings of the package.
     */
    record Success(List<LicenseFinding> findings) implements ScanResultsReadResult {

        public Success {
            findings = List.copyOf(requireNonNull(findings, "findings must not be null"));
        }

    }

    /**
     * @param message Why the findings could not be read.
     */
    record Failure(String message) implements ScanResultsReadResult {

        public Failure {
            requireNonNull(message, "message must not be null");
        }

    }

}
