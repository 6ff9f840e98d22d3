package com.e2eq.atlas.core;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Entity kinds of the atlas knowledge graph.
 * <p>
 * Each constant carries the ontology class label and the name of the container
 * collection the loader reads its records from.
 * </p>
 */
public enum EntityType {

    // Risk entities
    RISK("Risk", "risks"),
    RISK_GROUP("RiskGroup", "riskgroups"),
    RISK_TAXONOMY("RiskTaxonomy", "taxonomies"),
    RISK_CONTROL("RiskControl", "riskcontrols"),
    RISK_INCIDENT("RiskIncident", "riskincidents"),
    ACTION("Action", "actions"),

    // AI system entities
    AI_SYSTEM("AiSystem", "aisystems"),
    AI_MODEL("AiModel", "aimodels"),
    AI_TASK("AiTask", "aitasks"),
    USE_CASE("UseCase", "usecases"),

    // Capability entities
    CAPABILITY("Capability", "capabilities"),
    CAPABILITY_GROUP("CapabilityGroup", "capabilitygroups"),
    CAPABILITY_DOMAIN("CapabilityDomain", "capabilitydomains"),
    CAPABILITY_TAXONOMY("CapabilityTaxonomy", "capabilitytaxonomies"),

    // Intrinsic entities
    LLM_INTRINSIC("LLMIntrinsic", "llmintrinsics"),
    ADAPTER("Adapter", "adapters"),

    // Evaluation entities
    EVALUATION("Evaluation", "evaluations"),
    AI_EVAL_RESULT("AiEvalResult", "aievalresults"),
    BENCHMARK("BenchmarkMetadataCard", "benchmarkmetadatacards"),

    // Supporting entities
    STAKEHOLDER("Stakeholder", "stakeholders"),
    STAKEHOLDER_GROUP("StakeholderGroup", "stakeholdergroups"),
    DOCUMENT("Documentation", "documents"),
    DATASET("Dataset", "datasets"),
    PRINCIPLE("Principle", "principles"),
    POLICY("LLMQuestionPolicy", "llmquestionpolicies"),
    RULE("Rule", "rules"),
    LICENSE("License", "licenses"),
    ORGANIZATION("Organization", "organizations");

    private static final Map<String, EntityType> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EntityType::label, t -> t));
    private static final Map<String, EntityType> BY_COLLECTION = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EntityType::collectionName, t -> t));

    private final String label;
    private final String collectionName;

    EntityType(String label, String collectionName) {
        this.label = label;
        this.collectionName = collectionName;
    }

    public String label() {
        return label;
    }

    public String collectionName() {
        return collectionName;
    }

    /**
     * Resolves a type from its class label, e.g. {@code "AiTask"}.
     *
     * @throws IllegalArgumentException if the label is unknown, listing the valid labels
     */
    public static EntityType fromLabel(String label) {
        EntityType type = label == null ? null : BY_LABEL.get(label.trim());
        if (type == null) {
            throw new IllegalArgumentException("Unknown entity type '" + label + "'. Expected one of: "
                    + Arrays.stream(values()).map(EntityType::label).collect(Collectors.joining(", ")));
        }
        return type;
    }

    public static Optional<EntityType> forCollection(String collectionName) {
        return Optional.ofNullable(collectionName == null ? null : BY_COLLECTION.get(collectionName));
    }
}
