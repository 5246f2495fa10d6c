package com.nas.fgraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the targets of {@code call_module} nodes (qualified sub-module paths
 * such as {@code features.0}) to the concrete layer type they resolve to
 * (such as {@code Conv2d}).
 */
public final class ModuleRegistry {
    private final Map<String, String> layerTypes;

    public ModuleRegistry(Map<String, String> layerTypes) {
        this.layerTypes = Collections.unmodifiableMap(new LinkedHashMap<>(layerTypes));
    }

    public static ModuleRegistry empty() {
        return new ModuleRegistry(Map.of());
    }

    public boolean contains(String target) {
        return layerTypes.containsKey(target);
    }

    public Optional<String> layerType(String target) {
        return Optional.ofNullable(layerTypes.get(target));
    }

    /**
     * @throws IllegalArgumentException if the target is not registered.
     */
    public String requireLayerType(String target) {
        String type = layerTypes.get(target);
        if (type == null)
            throw new IllegalArgumentException("Unknown module: " + target);
        return type;
    }

    public Map<String, String> asMap() {
        return layerTypes;
    }

    public int size() {
        return layerTypes.size();
    }
}
