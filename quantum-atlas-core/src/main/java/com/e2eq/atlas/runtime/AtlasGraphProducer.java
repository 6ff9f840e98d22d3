package com.e2eq.atlas.runtime;

import com.e2eq.atlas.core.*;
import io.quarkus.logging.Log;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads the entity snapshot once at startup and exposes the snapshot, its index and a shared
 * {@link GraphNavigator} for injection. Extra edge rules, when configured, are appended to the
 * atlas defaults.
 */
@ApplicationScoped
public class AtlasGraphProducer {

    private final List<String> dataResources;
    private final Optional<String> dataDir;
    private final Optional<String> edgeRulesResource;

    private EntitySnapshot snapshot;
    private EntityIndex index;
    private GraphNavigator navigator;

    @Inject
    public AtlasGraphProducer(@ConfigProperty(name = "quantum.atlas.data", defaultValue = "atlas/atlas-data.yaml")
                              String dataResources,
                              @ConfigProperty(name = "quantum.atlas.data-dir")
                              Optional<String> dataDir,
                              @ConfigProperty(name = "quantum.atlas.edge-rules")
                              Optional<String> edgeRulesResource) {
        this.dataResources = splitList(dataResources);
        this.dataDir = dataDir.filter(s -> !s.isBlank());
        this.edgeRulesResource = edgeRulesResource.filter(s -> !s.isBlank());
    }

    @PostConstruct
    void init() {
        this.snapshot = loadSnapshot();
        this.index = EntityIndex.of(snapshot);
        EdgeDerivationTable table = loadEdgeTable();
        this.navigator = new GraphNavigator(index, table);
        Log.infof("Atlas graph ready: %d entities, %d edge rules", index.size(), table.rules().size());
    }

    @Produces
    public EntitySnapshot snapshot() {
        return snapshot;
    }

    @Produces
    public EntityIndex index() {
        return index;
    }

    @Produces
    public GraphNavigator navigator() {
        return navigator;
    }

    private EntitySnapshot loadSnapshot() {
        List<Path> paths = new ArrayList<>();
        if (dataDir.isPresent()) {
            Path dir = Path.of(dataDir.get());
            if (!Files.isDirectory(dir)) {
                throw new IllegalStateException("Atlas data directory does not exist: " + dir);
            }
            paths.add(dir);
        }
        try {
            return new YamlEntitySnapshotLoader().load(dataResources, paths);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load atlas data from " + dataResources + dataDir.map(d -> " and " + d).orElse(""), e);
        }
    }

    private EdgeDerivationTable loadEdgeTable() {
        EdgeDerivationTable defaults = EdgeDerivationTable.atlasDefaults();
        if (edgeRulesResource.isEmpty()) {
            return defaults;
        }
        try {
            EdgeDerivationTable extra = new YamlEdgeRuleLoader().loadFromClasspath(edgeRulesResource.get());
            return EdgeDerivationTable.builder().addAll(defaults).addAll(extra).build();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load edge rules from " + edgeRulesResource.get(), e);
        }
    }

    private static List<String> splitList(String value) {
        List<String> out = new ArrayList<>();
        if (value == null) return out;
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) out.add(trimmed);
        }
        return out;
    }
}
