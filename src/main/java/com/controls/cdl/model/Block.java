package com.controls.cdl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable definition of a computational block.
 *
 * <p>
 * An {@link BlockKind#ELEMENTARY elementary} block names an implementation
 * type that the implementation registry resolves at initialization. A
 * {@link BlockKind#COMPOSITE composite} block owns an ordered list of child
 * instances and the connections that wire them to each other and to the
 * composite's own connectors.
 *
 * <p>
 * Definitions carry no instance paths and no runtime state. One definition
 * can be instantiated any number of times, inside one model or across
 * independent execution contexts.
 *
 * <p>
 * Well-formedness (unique names, resolvable references, single assignment,
 * acyclicity) is not enforced here; it is reported by the semantic validator
 * so that every problem of a model can be seen at once.
 */
public final class Block {
    private final String typeName;
    private final BlockKind kind;
    private final String description;
    private final List<Parameter> parameters;
    private final List<Connector> inputs;
    private final List<Connector> outputs;
    private final List<BlockInstance> children;
    private final List<Connection> connections;

    private Block(Builder b) {
        this.typeName = b.typeName;
        this.kind = b.kind;
        this.description = b.description;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(b.parameters));
        this.inputs = Collections.unmodifiableList(new ArrayList<>(b.inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(b.outputs));
        this.children = Collections.unmodifiableList(new ArrayList<>(b.children));
        this.connections = Collections.unmodifiableList(new ArrayList<>(b.connections));
    }

    /** Starts an elementary block whose behavior is registered under {@code typeName}. */
    public static Builder elementary(String typeName) {
        return new Builder(typeName, BlockKind.ELEMENTARY);
    }

    public static Builder composite(String typeName) {
        return new Builder(typeName, BlockKind.COMPOSITE);
    }

    public String typeName() {
        return typeName;
    }

    /**
     * The last dotted segment of the type name, used as the instance name when
     * a block is run as a model root.
     */
    public String simpleName() {
        return typeName.substring(typeName.lastIndexOf('.') + 1);
    }

    public BlockKind kind() {
        return kind;
    }

    public boolean isComposite() {
        return kind == BlockKind.COMPOSITE;
    }

    public boolean isElementary() {
        return kind == BlockKind.ELEMENTARY;
    }

    public String description() {
        return description;
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public List<Connector> inputs() {
        return inputs;
    }

    public List<Connector> outputs() {
        return outputs;
    }

    public List<BlockInstance> children() {
        return children;
    }

    public List<Connection> connections() {
        return connections;
    }

    public Optional<Connector> input(String name) {
        return find(inputs, name);
    }

    public Optional<Connector> output(String name) {
        return find(outputs, name);
    }

    /** Looks up an input first, then an output. */
    public Optional<Connector> connector(String name) {
        Optional<Connector> in = input(name);
        return in.isPresent() ? in : output(name);
    }

    public Optional<Parameter> parameter(String name) {
        for (Parameter p : parameters)
            if (p.name().equals(name))
                return Optional.of(p);
        return Optional.empty();
    }

    public Optional<BlockInstance> child(String name) {
        for (BlockInstance c : children)
            if (c.name().equals(name))
                return Optional.of(c);
        return Optional.empty();
    }

    /** Declaration index of a child, or -1. */
    public int childIndex(String name) {
        for (int i = 0; i < children.size(); i++)
            if (children.get(i).name().equals(name))
                return i;
        return -1;
    }

    private static Optional<Connector> find(List<Connector> list, String name) {
        for (Connector c : list)
            if (c.name().equals(name))
                return Optional.of(c);
        return Optional.empty();
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " block " + typeName;
    }

    /** Fluent builder; connector causality decides whether it lands in inputs or outputs. */
    public static final class Builder {
        private final String typeName;
        private final BlockKind kind;
        private String description;
        private final List<Parameter> parameters = new ArrayList<>();
        private final List<Connector> inputs = new ArrayList<>();
        private final List<Connector> outputs = new ArrayList<>();
        private final List<BlockInstance> children = new ArrayList<>();
        private final List<Connection> connections = new ArrayList<>();

        private Builder(String typeName, BlockKind kind) {
            if (typeName == null || typeName.isBlank())
                throw new IllegalArgumentException("Block type name cannot be empty");
            this.typeName = typeName.strip();
            this.kind = kind;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder parameter(Parameter parameter) {
            parameters.add(Objects.requireNonNull(parameter));
            return this;
        }

        public Builder connector(Connector connector) {
            if (connector.isInput())
                inputs.add(connector);
            else
                outputs.add(connector);
            return this;
        }

        public Builder input(String name, DataType type) {
            return connector(Connector.input(name, type).build());
        }

        public Builder output(String name, DataType type) {
            return connector(Connector.output(name, type).build());
        }

        public Builder child(BlockInstance instance) {
            children.add(Objects.requireNonNull(instance));
            return this;
        }

        public Builder child(String name, Block block) {
            return child(BlockInstance.of(name, block));
        }

        public Builder connection(Connection connection) {
            connections.add(Objects.requireNonNull(connection));
            return this;
        }

        /** Shorthand for {@code connection(Connection.of(from, to))}. */
        public Builder connect(String from, String to) {
            return connection(Connection.of(from, to));
        }

        public Block build() {
            if (kind == BlockKind.ELEMENTARY && (!children.isEmpty() || !connections.isEmpty()))
                throw new IllegalStateException(
                        "Elementary block " + typeName + " cannot declare children or connections");
            return new Block(this);
        }
    }
}
