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

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A parser for SPDX license expressions.
 * <p>
 * Operator precedence, from strongest to weakest, is {@code WITH}, {@code AND}, {@code OR}.
 * Parentheses override precedence. Operators are accepted in all-uppercase or all-lowercase.
 * <p>
 * The parser never throws for malformed input. Instead, a {@link SpdxParseResult.Failure}
 * describing the problem is returned.
 *
 * @since 1.0.0
 */
public final class SpdxExpressionParser {

    private enum TokenType {
        OPEN_PAREN,
        CLOSE_PAREN,
        AND,
        OR,
        WITH,
        IDENTIFIER
    }

    private record Token(TokenType type, String text, int position) {
    }

    private static final class MalformedExpressionException extends Exception {

        private MalformedExpressionException(final String message) {
            super(message, null, false, false);
        }

    }

    public SpdxParseResult parse(final @Nullable String expressionString) {
        if (expressionString == null || expressionString.isBlank()) {
            return new SpdxParseResult.Failure("Expression is empty");
        }

        try {
            final List<Token> tokens = tokenize(expressionString);
            final var cursor = new TokenCursor(tokens);
            final SpdxExpression expression = parseOr(cursor);
            if (cursor.hasNext()) {
                final Token token = cursor.next();
                throw new MalformedExpressionException("Unexpected token '%s' at position %d"
                        .formatted(token.text(), token.position()));
            }

            return new SpdxParseResult.Success(expression);
        } catch (MalformedExpressionException e) {
            return new SpdxParseResult.Failure(e.getMessage());
        }
    }

    private static SpdxExpression parseOr(final TokenCursor cursor) throws MalformedExpressionException {
        SpdxExpression expression = parseAnd(cursor);
        while (cursor.nextIs(TokenType.OR)) {
            cursor.next();
            expression = new SpdxCompoundExpression(expression, SpdxOperator.OR, parseAnd(cursor));
        }

        return expression;
    }

    private static SpdxExpression parseAnd(final TokenCursor cursor) throws MalformedExpressionException {
        SpdxExpression expression = parseWith(cursor);
        while (cursor.nextIs(TokenType.AND)) {
            cursor.next();
            expression = new SpdxCompoundExpression(expression, SpdxOperator.AND, parseWith(cursor));
        }

        return expression;
    }

    private static SpdxExpression parseWith(final TokenCursor cursor) throws MalformedExpressionException {
        final SpdxExpression expression = parsePrimary(cursor);
        if (!cursor.nextIs(TokenType.WITH)) {
            return expression;
        }

        final Token withToken = cursor.next();
        if (!(expression instanceof final SpdxLicenseIdExpression license)) {
            throw new MalformedExpressionException(
                    "Left operand of WITH at position %d must be a license identifier, but is: %s"
                            .formatted(withToken.position(), expression));
        }

        final Token exceptionToken = cursor.expect(TokenType.IDENTIFIER, "license exception identifier");
        return new SpdxLicenseWithExceptionExpression(license, exceptionToken.text());
    }

    private static SpdxExpression parsePrimary(final TokenCursor cursor) throws MalformedExpressionException {
        if (cursor.nextIs(TokenType.OPEN_PAREN)) {
            cursor.next();
            final SpdxExpression expression = parseOr(cursor);
            cursor.expect(TokenType.CLOSE_PAREN, "')'");
            return expression;
        }

        final Token token = cursor.expect(TokenType.IDENTIFIER, "license identifier or '('");
        if (token.text().indexOf('+') != token.text().length() - 1 && token.text().contains("+")) {
            throw new MalformedExpressionException("'+' is only allowed as suffix of a license identifier, but got '%s' at position %d"
                    .formatted(token.text(), token.position()));
        }
        if ("+".equals(token.text())) {
            throw new MalformedExpressionException("Dangling '+' at position %d".formatted(token.position()));
        }

        return SpdxLicenseIdExpression.of(token.text());
    }

    private static List<Token> tokenize(final String input) throws MalformedExpressionException {
        final var tokens = new ArrayList<Token>();

        int i = 0;
        while (i < input.length()) {
            final char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.OPEN_PAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.CLOSE_PAREN, ")", i++));
            } else if (isIdentifierChar(c)) {
                final int start = i;
                while (i < input.length() && isIdentifierChar(input.charAt(i))) {
                    i++;
                }

                final String word = input.substring(start, i);
                tokens.add(new Token(typeOf(word), word, start));
            } else {
                throw new MalformedExpressionException(
                        "Unexpected character '%c' at position %d".formatted(c, i));
            }
        }

        return tokens;
    }

    private static TokenType typeOf(final String word) {
        return switch (word) {
            case "AND", "and" -> TokenType.AND;
            case "OR", "or" -> TokenType.OR;
            case "WITH", "with" -> TokenType.WITH;
            default -> TokenType.IDENTIFIER;
        };
    }

    private static boolean isIdentifierChar(final char c) {
        return (c >= 'a' && c <= 'z')
                || (c >= 'A' && c <= 'Z')
                || (c >= '0' && c <= '9')
                || c == '-' || c == '.' || c == ':' || c == '+';
    }

    private static final class TokenCursor {

        private final List<Token> tokens;
        private int index;

        private TokenCursor(final List<Token> tokens) {
            this.tokens = tokens;
        }

        private boolean hasNext() {
            return index < tokens.size();
        }

        private boolean nextIs(final TokenType type) {
            return hasNext() && tokens.get(index).type() == type;
        }

        private Token next() {
            return tokens.get(index++);
        }

        private Token expect(final TokenType type, final String expected) throws MalformedExpressionException {
            if (!hasNext()) {
                throw new MalformedExpressionException("Expected %s, but reached end of expression".formatted(expected));
            }

            final Token token = next();
            if (token.type() != type) {
                throw new MalformedExpressionException("Expected %s, but got '%s' at position %d"
                        .formatted(expected, token.text(), token.position()));
            }

            return token;
        }

    }

}
