package com.nas.fgraph.inspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nas.fgraph.api.NodeCategory;
import com.nas.fgraph.api.OpKind;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Allow-list mapping (operation kind, key) to a node category.
 *
 * The key is the concrete layer type for {@code call_module} nodes (e.g.
 * {@code Conv2d}) and the target itself for functions and methods (e.g.
 * {@code torch.flatten}, {@code squeeze}). Each key maps to one category, so
 * table entries can never classify a node twice.
 *
 * The defaults ship as the classpath resource
 * {@value #DEFAULTS_RESOURCE}. Tables are mutable so callers can extend
 * them before handing them to a {@link NodeClassifier}.
 */
public final class ClassificationTable {
    private static final Logger log = LogManager.getLogger(ClassificationTable.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String DEFAULTS_RESOURCE = "/classification-defaults.json";

    private final Map<OpKind, Map<String, NodeCategory>> entries = new EnumMap<>(OpKind.class);
    private final Set<String> untouchable = new HashSet<>();

    public static ClassificationTable empty() {
        return new ClassificationTable();
    }

    /**
     * Loads the bundled defaults covering common convolution, linear,
     * normalization, pooling, activation, padding and connectivity ops.
     */
    public static ClassificationTable defaults() {
        try (InputStream in = ClassificationTable.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null)
                throw new IllegalStateException("Missing classpath resource " + DEFAULTS_RESOURCE);
            ClassificationTable table = fromConfig(MAPPER.readValue(in, ClassificationConfig.class));
            log.debug("Loaded {} default allow-list entries", table.size());
            return table;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + DEFAULTS_RESOURCE, e);
        }
    }

    /** Reads an allow-list file with the same layout as the bundled defaults. */
    public static ClassificationTable fromJson(Path path) throws IOException {
        return fromConfig(MAPPER.readValue(Files.readString(path), ClassificationConfig.class));
    }

    public static ClassificationTable fromConfig(ClassificationConfig config) {
        ClassificationTable table = new ClassificationTable();
        if (config.getEntries() != null) {
            for (ClassificationConfig.Entry e : config.getEntries()) {
                if (e.getTarget() == null)
                    throw new IllegalArgumentException("Allow-list entry without target: " + e);
                table.register(OpKind.fromString(e.getOp()), e.getTarget(), NodeCategory.fromString(e.getCategory()));
            }
        }
        if (config.getUntouchable() != null)
            config.getUntouchable().forEach(table::markUntouchable);
        return table;
    }

    /**
     * Adds or replaces an entry.
     *
     * @throws IllegalArgumentException for input and output kinds, whose
     *                                  category is fixed.
     */
    public ClassificationTable register(OpKind op, String key, NodeCategory category) {
        if (op == OpKind.INPUT || op == OpKind.OUTPUT)
            throw new IllegalArgumentException("Category of " + op.traceName() + " nodes is fixed");
        NodeCategory previous = entries.computeIfAbsent(op, k -> new HashMap<>()).put(key, category);
        if (previous != null && previous != category)
            log.warn("Allow-list entry {}:{} changed from {} to {}", op.traceName(), key, previous, category);
        return this;
    }

    public ClassificationTable markUntouchable(String key) {
        untouchable.add(key);
        return this;
    }

    public Optional<NodeCategory> lookup(OpKind op, String key) {
        Map<String, NodeCategory> byKey = entries.get(op);
        return byKey == null ? Optional.empty() : Optional.ofNullable(byKey.get(key));
    }

    public boolean isUntouchable(String key) {
        return untouchable.contains(key);
    }

    public int size() {
        int n = 0;
        for (Map<String, NodeCategory> m : entries.values())
            n += m.size();
        return n;
    }

    /** Independent copy, so extending it leaves the original untouched. */
    public ClassificationTable copy() {
        ClassificationTable t = new ClassificationTable();
        entries.forEach((op, m) -> t.entries.put(op, new HashMap<>(m)));
        t.untouchable.addAll(untouchable);
        return t;
    }
}
