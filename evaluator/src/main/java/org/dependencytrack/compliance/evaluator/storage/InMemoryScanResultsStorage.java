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
import org.dependencytrack.compliance.model.LicenseFinding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import static java.util.Objects.requireNonNull;

/**
 * An in-memory {@link ScanResultsStorage}.
 *
 * @since 1.0.0
 */
public final class InMemoryScanResultsStorage implements ScanResultsStorage {

    private final ConcurrentMap<Identifier, List<LicenseFinding>> findingsById = new ConcurrentHashMap<>();
    private final AtomicLong numReads = new AtomicLong();
    private final AtomicLong numHits = new AtomicLong();

    /**
     * Add license findings of a package. Findings are appended to the ones that were added before.
     *
     * @param id       The {@link Identifier} of the package
     * @param findings The {@link LicenseFinding}s to add
     * @return This storage
     */
    public InMemoryScanResultsStorage add(final Identifier id, final Collection<LicenseFinding> findings) {
        requireNonNull(id, "id must not be null");
        requireNonNull(findings, "findings must not be null");

        findingsById.merge(id, List.copyOf(findings), (existing, added) -> {
            final var merged = new ArrayList<LicenseFinding>(existing.size() + added.size());
            merged.addAll(existing);
            merged.addAll(added);
            return List.copyOf(merged);
        });

        return this;
    }

    @Override
    public ScanResultsReadResult read(final Identifier id) {
        requireNonNull(id, "id must not be null");

        numReads.incrementAndGet();
        final List<LicenseFinding> findings = findingsById.get(id);
        if (findings == null) {
            return new ScanResultsReadResult.Success(List.of());
        }

        numHits.incrementAndGet();
        return new ScanResultsReadResult.Success(findings);
    }

    @Override
    public AccessStatistics statistics() {
        // Hits first, so that numHits never exceeds numReads under concurrent reads.
        final long hits = numHits.get();
        return new AccessStatistics(numReads.get(), hits);
    }

}
