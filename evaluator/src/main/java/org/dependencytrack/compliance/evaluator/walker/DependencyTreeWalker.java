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
package org.dependencytrack.compliance.evaluator.walker;

import org.dependencytrack.compliance.model.AnalysisResult;
import org.dependencytrack.compliance.model.Package;
import org.dependencytrack.compliance.model.PackageReference;
import org.dependencytrack.compliance.model.Project;
import org.dependencytrack.compliance.model.Scope;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;

/**
 * Walks the dependency trees of all {@link Project}s and {@link Scope}s of an {@link AnalysisResult}.
 * <p>
 * Trees are walked depth-first, in pre-order. Projects, scopes and dependencies are visited
 * in the order they appear in the {@link AnalysisResult}. A package that appears at multiple
 * positions of a tree is visited once per position.
 * <p>
 * Each call to {@link #iterator()} starts a new walk, so the walker can be iterated any number of times.
 * Iterators are lazy and use an explicit stack, so deep trees do not exhaust the call stack.
 *
 * @since 1.0.0
 */
public final class DependencyTreeWalker implements Iterable<DependencyVisit> {

    private final AnalysisResult analysisResult;

    public DependencyTreeWalker(final AnalysisResult analysisResult) {
        this.analysisResult = requireNonNull(analysisResult, "analysisResult must not be null");
    }

    @Override
    public Iterator<DependencyVisit> iterator() {
        return new VisitIterator();
    }

    /**
     * @return All visits of a complete walk, in walk order
     */
    public List<DependencyVisit> toList() {
        final var visits = new ArrayList<DependencyVisit>();
        forEach(visits::add);
        return Collections.unmodifiableList(visits);
    }

    private record Frame(Iterator<PackageReference> dependencies, List<Package> ancestors) {
    }

    private final class VisitIterator implements Iterator<DependencyVisit> {

        private final Iterator<Project> projects = analysisResult.getProjects().iterator();
        private final Deque<Frame> stack = new ArrayDeque<>();
        private @Nullable Project currentProject;
        private @Nullable Iterator<Scope> scopes;
        private @Nullable Scope currentScope;
        private @Nullable DependencyVisit next;

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }

            return next != null;
        }

        @Override
        public DependencyVisit next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }

            final DependencyVisit visit = next;
            next = null;
            return visit;
        }

        private @Nullable DependencyVisit advance() {
            while (true) {
                final Frame frame = stack.peek();
                if (frame != null) {
                    if (!frame.dependencies().hasNext()) {
                        stack.pop();
                        continue;
                    }

                    final PackageReference dependency = frame.dependencies().next();
                    final Package pkg = analysisResult.resolvePackage(dependency.getId());
                    final var visit = new DependencyVisit(
                            currentProject, currentScope, dependency, pkg, frame.ancestors(), frame.ancestors().size());

                    if (!dependency.getDependencies().isEmpty()) {
                        final var childAncestors = new ArrayList<Package>(frame.ancestors().size() + 1);
                        childAncestors.addAll(frame.ancestors());
                        childAncestors.add(pkg);
                        stack.push(new Frame(dependency.getDependencies().iterator(), List.copyOf(childAncestors)));
                    }

                    return visit;
                }

                if (scopes != null && scopes.hasNext()) {
                    currentScope = scopes.next();
                    stack.push(new Frame(currentScope.dependencies().iterator(), List.of()));
                    continue;
                }

                if (projects.hasNext()) {
                    currentProject = projects.next();
                    scopes = currentProject.scopes().iterator();
                    continue;
                }

                return null;
            }
        }

    }

}
