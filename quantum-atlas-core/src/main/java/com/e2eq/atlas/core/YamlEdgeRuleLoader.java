package com.e2eq.atlas.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads additional edge derivation rules from YAML:
 * <pre>{@code
 * rules:
 *   - source: Dataset
 *     attribute: hasLicense
 *     relation: hasLicense
 *     target: License
 *   - attribute: hasStakeholder     # no source: applies to every type
 *     relation: hasStakeholder
 *     target: Stakeholder
 * }</pre>
 * Types and relations are given by label.
 */
public final class YamlEdgeRuleLoader {

    // DTOs mirroring YAML
    public record YRules(List<YRule> rules) {}
    public record YRule(String source, String attribute, String relation, String target) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public EdgeDerivationTable loadFromClasspath(String resourcePath) throws IOException {
        String normalized = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = YamlEdgeRuleLoader.class.getClassLoader();
        }
        try (InputStream in = cl.getResourceAsStream(normalized)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return load(in);
        }
    }

    public EdgeDerivationTable loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public EdgeDerivationTable load(InputStream in) throws IOException {
        return toTable(mapper.readValue(in, YRules.class));
    }

    private EdgeDerivationTable toTable(YRules y) {
        EdgeDerivationTable.Builder b = EdgeDerivationTable.builder();
        List<YRule> rules = y == null ? List.of() : Optional.ofNullable(y.rules()).orElse(List.of());
        for (YRule r : rules) {
            EntityType source = r.source() == null || r.source().isBlank() ? null : EntityType.fromLabel(r.source());
            b.add(new EdgeRule(source, r.attribute(), RelationType.fromLabel(r.relation()), EntityType.fromLabel(r.target())));
        }
        return b.build();
    }
}
