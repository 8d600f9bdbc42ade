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
package org.dependencytrack.compliance.spdx.expression;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SpdxExpressionParserTest {

    private final SpdxExpressionParser parser = new SpdxExpressionParser();

    private SpdxExpression parseValid(final String input) {
        final SpdxParseResult result = parser.parse(input);
        assertThat(result).isInstanceOf(SpdxParseResult.Success.class);
        assertThat(result.toOptional()).isPresent();
        return ((SpdxParseResult.Success) result).expression();
    }

    @Nested
    class PrecedenceTest {

        @Test
        void shouldBindAndStrongerThanOr() {
            final SpdxExpression expression = parseValid("LGPL-2.1-only OR BSD-3-Clause AND MIT");

            assertThat(expression).isEqualTo(new SpdxCompoundExpression(
                    SpdxLicenseIdExpression.of("LGPL-2.1-only"),
                    SpdxOperator.OR,
                    new SpdxCompoundExpression(
                            SpdxLicenseIdExpression.of("BSD-3-Clause"),
                            SpdxOperator.AND,
                            SpdxLicenseIdExpression.of("MIT"))));
        }

        @Test
        void shouldBindWithStrongerThanAnd() {
            final SpdxExpression expression = parseValid("LGPL-2.1-only WITH CPE AND MIT OR BSD-3-Clause");

            assertThat(expression).hasToString("LGPL-2.1-only WITH CPE AND MIT OR BSD-3-Clause");
            assertThat(expression).isInstanceOfSatisfying(SpdxCompoundExpression.class, compound -> {
                assertThat(compound.operator()).isEqualTo(SpdxOperator.OR);
                assertThat(compound.left()).isInstanceOfSatisfying(SpdxCompoundExpression.class, and -> {
                    assertThat(and.operator()).isEqualTo(SpdxOperator.AND);
                    assertThat(and.left()).isEqualTo(new SpdxLicenseWithExceptionExpression(
                            SpdxLicenseIdExpression.of("LGPL-2.1-only"), "CPE"));
                });
            });
        }

        @Test
        void shouldLetParenthesesOverridePrecedence() {
            final SpdxExpression expression = parseValid("MIT AND (LGPL-2.1-or-later OR BSD-3-Clause)");

            assertThat(expression).hasToString("MIT AND (LGPL-2.1-or-later OR BSD-3-Clause)");
            assertThat(expression).isInstanceOfSatisfying(SpdxCompoundExpression.class,
                    compound -> assertThat(compound.operator()).isEqualTo(SpdxOperator.AND));
        }

        @Test
        void shouldParseWithoutSpacesAroundParentheses() {
            final SpdxExpression expression = parseValid("(MIT)AND(LGPL-2.1-or-later OR Apache-2.0)");

            assertThat(expression.licenses()).containsExactly("MIT", "LGPL-2.1-or-later", "Apache-2.0");
        }

        @Test
        void shouldAcceptLowercaseOperators() {
            final SpdxExpression expression = parseValid("mit or apache-2.0");

            assertThat(expression).isInstanceOfSatisfying(SpdxCompoundExpression.class,
                    compound -> assertThat(compound.operator()).isEqualTo(SpdxOperator.OR));
        }

    }

    @Nested
    class DecomposeTest {

        @Test
        void shouldRecurseThroughAllOperators() {
            final SpdxExpression expression = parseValid(
                    "(Apache-2.0 OR MIT) AND GPL-2.0-only WITH Classpath-exception-2.0 AND LicenseRef-acme");

            assertThat(expression.licenses()).containsExactly(
                    "Apache-2.0", "MIT", "GPL-2.0-only", "LicenseRef-acme");
        }

        @Test
        void shouldNormalizeDeprecatedPlusSuffix() {
            final SpdxExpression expression = parseValid("GPL-2.0+ OR MIT");

            assertThat(expression.decompose()).containsExactly(
                    new SpdxLicenseIdExpression("GPL-2.0", true),
                    new SpdxLicenseIdExpression("MIT", false));
            assertThat(expression.licenses()).containsExactly("GPL-2.0+", "MIT");
        }

        @Test
        void shouldFlagOrLaterIdentifiers() {
            final SpdxExpression expression = parseValid("GPL-3.0-or-later");

            assertThat(expression).isEqualTo(new SpdxLicenseIdExpression("GPL-3.0-or-later", true));
            assertThat(expression).hasToString("GPL-3.0-or-later");
        }

        @Test
        void shouldDeduplicateRepeatedLicenses() {
            final SpdxExpression expression = parseValid("MIT OR (MIT AND Apache-2.0)");

            assertThat(expression.licenses()).containsExactly("MIT", "Apache-2.0");
        }

        @Test
        void shouldParseDocumentReferences() {
            final SpdxExpression expression = parseValid("DocumentRef-spdx-tool-1.2:LicenseRef-MIT-Style-2");

            assertThat(expression.licenses()).containsExactly("DocumentRef-spdx-tool-1.2:LicenseRef-MIT-Style-2");
        }

    }

    @Nested
    class FailureTest {

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {" ", "\t"})
        void shouldFailForBlankInput(final String input) {
            assertThat(parser.parse(input)).isEqualTo(new SpdxParseResult.Failure("Expression is empty"));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "MIT (OR BSD-3-Clause",
                "MIT )(OR BSD-3-Clause",
                "(MIT",
                "MIT)",
                "MIT AND",
                "OR MIT",
                "MIT Apache-2.0",
                "(MIT OR Apache-2.0) WITH CPE",
                "MIT WITH",
                "GPL+2.0",
                "MIT / Apache-2.0",
                "MIT AND + "
        })
        void shouldFailForMalformedInput(final String input) {
            final SpdxParseResult result = parser.parse(input);

            assertThat(result).isInstanceOfSatisfying(SpdxParseResult.Failure.class,
                    failure -> assertThat(failure.reason()).isNotBlank());
            assertThat(result.toOptional()).isEmpty();
        }

        @Test
        void shouldReportPositionOfUnexpectedCharacter() {
            assertThat(parser.parse("MIT / Apache-2.0")).isEqualTo(
                    new SpdxParseResult.Failure("Unexpected character '/' at position 4"));
        }

    }

}
