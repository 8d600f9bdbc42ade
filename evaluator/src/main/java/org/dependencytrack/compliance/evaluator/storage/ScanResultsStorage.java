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

import org.dependencytrack.compliance.model.Identifier;

/**
 * Read access to the results of scanning packages for licenses.
 * <p>
 * Storages are passed explicitly to the components that need them.
 *
 * @since 1.0.0
 */
public interface ScanResultsStorage {

    /**
     * @return Name of the storage, for logging purposes
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Read the license findings of a package.
     * <p>
     * A package that was never scanned yields a {@link ScanResultsReadResult.Success} without findings.
     *
     * @param id The {@link Identifier} of the package
     * @return The {@link ScanResultsReadResult}
     */
    ScanResultsReadResult read(Identifier id);

    /**
     * @return A snapshot of the {@link AccessStatistics} of this storage
     */
    AccessStatistics statistics();

}
