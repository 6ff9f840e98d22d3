package com.e2eq.atlas.core;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Directed relationship kinds between atlas entities.
 */
public enum RelationType {

    // Risk relationships
    HAS_RELATED_RISK("hasRelatedRisk"),
    HAS_RELATED_ACTION("hasRelatedAction"),
    IS_DETECTED_BY("isDetectedBy"),
    DETECTS_RISK_CONCEPT("detectsRiskConcept"),
    REFERS_TO_RISK("refersToRisk"),

    // Task-capability relationships
    REQUIRES_CAPABILITY("requiresCapability"),
    REQUIRED_BY_TASK("requiredByTask"),

    // Capability-intrinsic relationships
    IMPLEMENTS_CAPABILITY("implementsCapability"),
    IMPLEMENTED_BY_INTRINSIC("implementedByIntrinsic"),
    IMPLEMENTS_CAPABILITY_ADAPTER("implementsCapability_adapter"),
    IMPLEMENTED_BY_ADAPTER("implementedByAdapter"),

    // Capability-benchmark relationships
    EVALUATES_CAPABILITY("evaluatesCapability"),
    EVALUATED_BY_BENCHMARK("evaluatedByBenchmark"),

    // Hierarchy relationships
    IS_PART_OF("isPartOf"),
    HAS_PART("hasPart"),
    BELONGS_TO_DOMAIN("belongsToDomain"),
    IS_DEFINED_BY_TAXONOMY("isDefinedByTaxonomy"),

    // SKOS relationships
    EXACT_MATCH("exactMatch"),
    CLOSE_MATCH("closeMatch"),
    BROAD_MATCH("broadMatch"),
    NARROW_MATCH("narrowMatch"),
    RELATED_MATCH("relatedMatch"),

    // Evaluation relationships
    HAS_EVALUATION("hasEvaluation"),
    EVALUATES_RISK("evaluatesRisk"),
    HAS_RELATED_LLMINTRINSIC("hasRelatedLLMIntrinsic"),

    // Documentation relationships
    HAS_DOCUMENTATION("hasDocumentation"),
    HAS_LICENSE("hasLicense"),

    // AI system relationships
    HAS_AI_TASK("hasAiTask"),
    HAS_STAKEHOLDER("hasStakeholder"),

    // Rule relationships
    HAS_RULE("hasRule");

    /** The five SKOS mapping relations, in declaration order. */
    public static final Set<RelationType> SKOS_MATCHES = Collections.unmodifiableSet(
            EnumSet.of(EXACT_MATCH, CLOSE_MATCH, BROAD_MATCH, NARROW_MATCH, RELATED_MATCH));

    private static final Map<String, RelationType> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(RelationType::label, r -> r));

    private final String label;

    RelationType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a relation from its label, e.g. {@code "requiresCapability"}.
     *
     * @throws IllegalArgumentException if the label is unknown, listing the valid labels
     */
    public static RelationType fromLabel(String label) {
        RelationType type = label == null ? null : BY_LABEL.get(label.trim());
        if (type == null) {
            throw new IllegalArgumentException("Unknown relation type '" + label + "'. Expected one of: "
                    + Arrays.stream(values()).map(RelationType::label).collect(Collectors.joining(", ")));
        }
        return type;
    }
}
