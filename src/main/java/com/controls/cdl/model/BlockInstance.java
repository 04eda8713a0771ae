package com.controls.cdl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named use of a block definition, with instantiation-time parameter
 * overrides. Override values are either literals or {@link ParentParameter}
 * references to the enclosing instance's parameters.
 */
public final class BlockInstance {
    private final String name;
    private final Block block;
    private final Map<String, Object> overrides;

    private BlockInstance(String name, Block block, Map<String, Object> overrides) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Instance name cannot be empty");
        if (name.indexOf('.') >= 0)
            throw new IllegalArgumentException("Instance name cannot contain '.': " + name);
        this.name = name.strip();
        this.block = Objects.requireNonNull(block, "block");
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    public static BlockInstance of(String name, Block block) {
        return new BlockInstance(name, block, Map.of());
    }

    public static BlockInstance of(String name, Block block, Map<String, Object> overrides) {
        return new BlockInstance(name, block, overrides);
    }

    /** Returns a copy with one more override. */
    public BlockInstance with(String parameter, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(overrides);
        next.put(parameter, value);
        return new BlockInstance(name, block, next);
    }

    public String name() {
        return name;
    }

    public Block block() {
        return block;
    }

    public Map<String, Object> overrides() {
        return overrides;
    }

    @Override
    public String toString() {
        return name + " : " + block.typeName();
    }
}
