package com.e2eq.atlas.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.quarkus.logging.Log;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads an {@link EntitySnapshot} from YAML container documents of the form
 * <pre>{@code
 * aitasks:
 *   - id: question-answering
 *     name: Question Answering
 *     requiresCapability: [cap-reading, cap-retrieval]
 * capabilities:
 *   - id: cap-reading
 * }</pre>
 * Top-level keys are collection names (see {@link EntityType#collectionName()}).
 * <p>
 * Records of one type sharing an id, typically split across files by the mapping import, are
 * merged: the first occurrence fixes attribute order, list values are concatenated, a value for
 * a missing or null attribute is taken, and any other conflicting value keeps the first one.
 * </p>
 */
public final class YamlEntitySnapshotLoader {

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public EntitySnapshot loadFromClasspath(String... resourcePaths) throws IOException {
        return load(Arrays.asList(resourcePaths), List.of());
    }

    /**
     * Loads a single YAML file, or every {@code *.yaml}/{@code *.yml} below a directory.
     */
    public EntitySnapshot loadFromPath(Path path) throws IOException {
        return load(List.of(), List.of(path));
    }

    public EntitySnapshot load(InputStream in) throws IOException {
        Accumulator acc = new Accumulator();
        acc.addDocument(read(in), "<stream>");
        return acc.toSnapshot();
    }

    /**
     * Loads classpath resources first, then the given files and directories, merging everything
     * into one snapshot. A missing resource or an unreadable explicit file fails the load; a file
     * found while scanning a directory that cannot be parsed is logged and skipped.
     */
    public EntitySnapshot load(List<String> classpathResources, List<Path> paths) throws IOException {
        Accumulator acc = new Accumulator();
        for (String resource : classpathResources) {
            acc.addDocument(readResource(resource), resource);
        }
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                for (Path file : yamlFilesUnder(path)) {
                    try (InputStream in = Files.newInputStream(file)) {
                        acc.addDocument(read(in), file.toString());
                    } catch (IOException e) {
                        Log.warnf(e, "YAML ignored: %s. Failed to load", file);
                    }
                }
            } else {
                try (InputStream in = Files.newInputStream(path)) {
                    acc.addDocument(read(in), path.toString());
                }
            }
        }
        EntitySnapshot snapshot = acc.toSnapshot();
        Log.infof("Loaded entity snapshot: %d entities in %d collections", snapshot.size(), snapshot.collections().size());
        return snapshot;
    }

    private Map<String, Object> readResource(String resourcePath) throws IOException {
        String normalized = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) {
            cl = YamlEntitySnapshotLoader.class.getClassLoader();
        }
        try (InputStream in = cl.getResourceAsStream(normalized)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return read(in);
        }
    }

    private Map<String, Object> read(InputStream in) throws IOException {
        Map<String, Object> doc = mapper.readValue(in, DOCUMENT);
        return doc == null ? Map.of() : doc;
    }

    private static List<Path> yamlFilesUnder(Path dir) throws IOException {
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Collects records from several documents and merges same-id records per type.
     */
    static final class Accumulator {
        private final Map<EntityType, Map<String, Map<String, Object>>> records = new EnumMap<>(EntityType.class);

        void addDocument(Map<String, Object> document, String source) {
            for (Map.Entry<String, Object> entry : document.entrySet()) {
                Optional<EntityType> type = EntityType.forCollection(entry.getKey());
                if (type.isEmpty()) {
                    Log.infof("Skipping unknown collection '%s' in %s", entry.getKey(), source);
                    continue;
                }
                if (!(entry.getValue() instanceof List<?> items)) {
                    if (entry.getValue() != null) {
                        Log.warnf("Collection '%s' in %s is not a list; skipped", entry.getKey(), source);
                    }
                    continue;
                }
                for (Object item : items) {
                    addRecord(type.get(), item, source);
                }
            }
        }

        @SuppressWarnings("unchecked")
        private void addRecord(EntityType type, Object item, String source) {
            if (!(item instanceof Map<?, ?> raw)) {
                Log.warnf("Non-mapping %s entry in %s skipped", type.label(), source);
                return;
            }
            Map<String, Object> attrs = (Map<String, Object>) raw;
            Object rawId = attrs.get(EntityRecord.ATTR_ID);
            if (rawId == null || String.valueOf(rawId).isBlank()) {
                Log.warnf("%s entry without id in %s skipped", type.label(), source);
                return;
            }
            String id = String.valueOf(rawId);

            Map<String, Map<String, Object>> byId = records.computeIfAbsent(type, k -> new LinkedHashMap<>());
            Map<String, Object> merged = byId.get(id);
            if (merged == null) {
                merged = new LinkedHashMap<>();
                byId.put(id, merged);
            }
            for (Map.Entry<String, Object> attr : attrs.entrySet()) {
                if (EntityRecord.ATTR_ID.equals(attr.getKey())) {
                    continue;
                }
                mergeAttribute(merged, type, id, attr.getKey(), attr.getValue());
            }
        }

        private static void mergeAttribute(Map<String, Object> merged, EntityType type, String id, String key, Object value) {
            if (!merged.containsKey(key) || merged.get(key) == null) {
                merged.put(key, value instanceof List<?> l ? new ArrayList<>(l) : value);
                return;
            }
            Object existing = merged.get(key);
            if (value == null) {
                return;
            }
            if (existing instanceof List<?> list) {
                List<Object> combined = new ArrayList<>(list);
                if (value instanceof List<?> more) {
                    combined.addAll(more);
                } else {
                    combined.add(value);
                }
                merged.put(key, combined);
            } else if (!existing.equals(value)) {
                Log.debugf("Conflicting value for %s:%s attribute '%s'; keeping the first", type.label(), id, key);
            }
        }

        EntitySnapshot toSnapshot() {
            EntitySnapshot.Builder b = EntitySnapshot.builder();
            records.forEach((type, byId) -> byId.forEach((id, attrs) -> b.add(type, id, attrs)));
            return b.build();
        }
    }
}
