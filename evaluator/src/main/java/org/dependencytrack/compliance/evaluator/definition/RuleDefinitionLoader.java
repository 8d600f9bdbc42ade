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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.networknt.schema.serialization.DefaultJsonNodeReader;
import org.dependencytrack.compliance.evaluator.LicenseView;
import org.dependencytrack.compliance.evaluator.Rule;
import org.dependencytrack.compliance.evaluator.matcher.MatcherFactory;
import org.dependencytrack.compliance.model.Identifier;
import org.dependencytrack.compliance.model.Package;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Loads {@link Rule}s from YAML rule definition documents.
 * <p>
 * Documents are validated against the JSON schema of their version before any rule is compiled.
 * Atoms referenced by conditions are resolved through a {@link MatcherRegistry}.
 * <p>
 * Example document:
 * <pre>{@code
 * version: v1
 * rules:
 * - name: no-gpl-in-static-deps
 *   severity: FAIL
 *   polarity: FLAG_IF_MATCHED
 *   views: [CONCLUDED_OR_REST]
 *   per_license: true
 *   message: "${package} is statically linked and licensed under ${license}"
 *   condition:
 *     all:
 *     - atom: is_statically_linked
 *     - atom: is_license
 *       args: [GPL-2.0-only]
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RuleDefinitionLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleDefinitionLoader.class);
    private static final Set<String> SUPPORTED_VERSIONS = Set.of("v1");

    private final MatcherRegistry matcherRegistry;
    private final ObjectMapper yamlMapper;
    private final JsonSchemaFactory jsonSchemaFactory;

    public RuleDefinitionLoader(final MatcherRegistry matcherRegistry) {
        this.matcherRegistry = requireNonNull(matcherRegistry, "matcherRegistry must not be null");
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.jsonSchemaFactory = JsonSchemaFactory
                .builder(JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012))
                .jsonNodeReader(
                        DefaultJsonNodeReader.builder()
                                .jsonMapper(new ObjectMapper())
                                .yamlMapper(yamlMapper)
                                .build())
                .build();
    }

    public RuleDefinitionLoader() {
        this(MatcherRegistry.withBuiltins());
    }

    public List<Rule> load(final Path path) {
        requireNonNull(path, "path must not be null");

        try (final InputStream fis = Files.newInputStream(path)) {
            return load(fis, path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rule definitions file: " + path, e);
        }
    }

    /**
     * @param inputStream The {@link InputStream} to read the document from
     * @param sourceName  Name of the source the document is read from, used in error messages
     * @return The {@link Rule}s, in the order they are defined in
     * @throws InvalidRuleDefinitionException When the document is invalid
     * @throws UncheckedIOException           When reading the document failed
     */
    public List<Rule> load(final InputStream inputStream, final String sourceName) {
        requireNonNull(inputStream, "inputStream must not be null");
        requireNonNull(sourceName, "sourceName must not be null");

        final JsonNode jsonNode;
        try {
            jsonNode = yamlMapper.readTree(inputStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rule definitions from " + sourceName, e);
        }

        if (jsonNode == null || !jsonNode.isObject()) {
            throw new InvalidRuleDefinitionException("Rule definitions in %s must be an object".formatted(sourceName));
        }

        final JsonNode versionNode = jsonNode.get("version");
        if (versionNode == null) {
            throw new InvalidRuleDefinitionException("Rule definitions in %s are missing the 'version' field".formatted(sourceName));
        }

        final String version;
        if (versionNode instanceof final TextNode versionTextNode) {
            version = requireSupportedVersion(versionTextNode.asText());
        } else {
            throw new InvalidRuleDefinitionException(
                    "'version' field must be of type %s, but is: %s".formatted(
                            JsonNodeType.STRING, versionNode.getNodeType()));
        }

        final JsonSchema jsonSchema = getJsonSchema(version);

        final Set<ValidationMessage> validationMessages = jsonSchema.validate(jsonNode);
        if (!validationMessages.isEmpty()) {
            throw new InvalidRuleDefinitionException("Rule definitions in %s are invalid: %s".formatted(
                    sourceName, validationMessages.stream().map(ValidationMessage::getMessage).collect(Collectors.joining(", "))));
        }

        final var definitions = yamlMapper.convertValue(jsonNode, RuleDefinitions.class);

        final var ruleNames = new HashSet<String>();
        final var rules = new ArrayList<Rule>(definitions.rules().size());
        for (final RuleDefinition definition : definitions.rules()) {
            if (!ruleNames.add(definition.name())) {
                throw new InvalidRuleDefinitionException("Duplicate rule '%s' in %s".formatted(definition.name(), sourceName));
            }

            rules.add(compileRule(definition));
        }

        LOGGER.debug("Loaded {} rules from {}", rules.size(), sourceName);
        return List.copyOf(rules);
    }

    private Rule compileRule(final RuleDefinition definition) {
        final MatcherFactory condition;
        try {
            condition = compileCondition(definition.condition());
        } catch (InvalidRuleDefinitionException e) {
            throw new InvalidRuleDefinitionException(
                    "Condition of rule '%s' is invalid: %s".formatted(definition.name(), e.getMessage()), e);
        }

        final var views = new ArrayList<LicenseView>();
        if (definition.views() != null) {
            for (final String viewName : definition.views()) {
                try {
                    views.add(LicenseView.of(viewName));
                } catch (IllegalArgumentException e) {
                    throw new InvalidRuleDefinitionException(
                            "Rule '%s' references an unknown license view '%s'".formatted(definition.name(), viewName), e);
                }
            }
        }

        return new Rule(definition.name(), condition, definition.polarity(), definition.severity(), definition.message())
                .withHowToFix(definition.howToFix())
                .withLicenseViews(views)
                .withPerLicense(Boolean.TRUE.equals(definition.perLicense()));
    }

    private MatcherFactory compileCondition(final JsonNode node) {
        if (node.has("all")) {
            return MatcherFactory.allOf(compileConditions(node.get("all")));
        } else if (node.has("any")) {
            return MatcherFactory.anyOf(compileConditions(node.get("any")));
        } else if (node.has("not")) {
            return MatcherFactory.not(compileCondition(node.get("not")));
        } else if (node.has("atom")) {
            final var args = new ArrayList<String>();
            if (node.has("args")) {
                node.get("args").forEach(argNode -> args.add(argNode.asText()));
            }

            return matcherRegistry.create(node.get("atom").asText(), args);
        } else if (node.has("ancestor")) {
            return compileAncestorCondition(node.get("ancestor"));
        }

        throw new InvalidRuleDefinitionException("Unsupported condition: " + node);
    }

    private List<MatcherFactory> compileConditions(final JsonNode arrayNode) {
        final var factories = new ArrayList<MatcherFactory>(arrayNode.size());
        for (final JsonNode node : arrayNode) {
            factories.add(compileCondition(node));
        }

        return factories;
    }

    private static MatcherFactory compileAncestorCondition(final JsonNode node) {
        if (node.has("id")) {
            final Identifier id;
            try {
                id = Identifier.of(node.get("id").asText());
            } catch (IllegalArgumentException e) {
                throw new InvalidRuleDefinitionException(e.getMessage(), e);
            }

            return rule -> rule.hasAncestorWithId(id);
        }

        Predicate<Package> predicate = ancestor -> true;
        final var descriptions = new ArrayList<String>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            final String value = field.getValue().asText();
            final Predicate<Package> fieldPredicate = switch (field.getKey()) {
                case "type" -> ancestor -> ancestor.id().type().equalsIgnoreCase(value);
                case "namespace" -> ancestor -> value.equals(ancestor.id().namespace());
                case "name" -> ancestor -> ancestor.id().name().equals(value);
                default -> throw new InvalidRuleDefinitionException("Unsupported ancestor field '%s'".formatted(field.getKey()));
            };
            predicate = predicate.and(fieldPredicate);
            descriptions.add("%s '%s'".formatted(field.getKey(), value));
        }

        final Predicate<Package> ancestorPredicate = predicate;
        final String description = "with " + String.join(" and ", descriptions);
        return rule -> rule.hasAncestor(ancestorPredicate, description);
    }

    private JsonSchema getJsonSchema(final String version) {
        try (final InputStream fis = getClass().getResourceAsStream(
                "schema/rule-definitions-%s.schema.json".formatted(version))) {
            if (fis == null) {
                throw new NoSuchElementException("No JSON schema found for version " + version);
            }

            return jsonSchemaFactory.getSchema(fis);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load JSON schema", e);
        }
    }

    private static String requireSupportedVersion(final String version) {
        if (SUPPORTED_VERSIONS.contains(version)) {
            return version;
        }

        throw new InvalidRuleDefinitionException(
                "Rule definitions version '%s' is not supported. Supported versions are: %s".formatted(
                        version, String.join(", ", SUPPORTED_VERSIONS)));
    }

}
