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
package org.dependencytrack.compliance.model;

import com.github.packageurl.MalformedPackageURLException;
import com.github.packageurl.PackageURL;
import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Coordinates of a {@link Package} or {@link Project}, backed by a Package URL.
 * <p>
 * The {@code type} denotes the package manager (e.g. {@code maven}, {@code npm}),
 * the {@code namespace} the organization that publishes the package.
 *
 * @see <a href="https://github.com/package-url/purl-spec">Package URL specification</a>
 * @since 1.0.0
 */
public record Identifier(
        String type,
        @Nullable String namespace,
        String name,
        @Nullable String version) implements Comparable<Identifier> {

    public Identifier {
        requireNonNull(type, "type must not be null");
        requireNonNull(name, "name must not be null");

        // Equality follows the normalized Package URL, e.g. lowercase type, pypi names.
        final PackageURL purl = toPackageUrl(type, namespace, name, version);
        type = purl.getType();
        namespace = purl.getNamespace();
        name = purl.getName();
        version = purl.getVersion();
    }

    /**
     * Parse an {@link Identifier} from a Package URL.
     *
     * @param purl The Package URL to parse, e.g. {@code pkg:maven/org.acme/acme-lib@1.2.3}
     * @return The parsed {@link Identifier}
     * @throws IllegalArgumentException When {@code purl} is not a valid Package URL
     */
    public static Identifier of(final String purl) {
        requireNonNull(purl, "purl must not be null");

        final PackageURL parsedPurl;
        try {
            parsedPurl = new PackageURL(purl);
        } catch (MalformedPackageURLException e) {
            throw new IllegalArgumentException("Invalid Package URL: " + purl, e);
        }

        return new Identifier(
                parsedPurl.getType(),
                parsedPurl.getNamespace(),
                parsedPurl.getName(),
                parsedPurl.getVersion());
    }

    /**
     * @return The canonical Package URL of this {@link Identifier}
     */
    public String toPurl() {
        return toPackageUrl(type, namespace, name, version).canonicalize();
    }

    @Override
    public int compareTo(final Identifier other) {
        return toPurl().compareTo(other.toPurl());
    }

    @Override
    public String toString() {
        return toPurl();
    }

    private static PackageURL toPackageUrl(
            final String type,
            final @Nullable String namespace,
            final String name,
            final @Nullable String version) {
        try {
            return new PackageURL(type, namespace, name, version, null, null);
        } catch (MalformedPackageURLException e) {
            throw new IllegalArgumentException("Identifier does not form a valid Package URL: %s/%s/%s@%s"
                    .formatted(type, namespace, name, version), e);
        }
    }

}
