package com.controls.cdl.validation;

import com.controls.cdl.config.EngineOptions;
import com.controls.cdl.engine.AlgebraicLoopException;
import com.controls.cdl.engine.DependencyGraph;
import com.controls.cdl.engine.Scheduler;
import com.controls.cdl.model.Block;
import com.controls.cdl.model.BlockInstance;
import com.controls.cdl.model.Connection;
import com.controls.cdl.model.Connector;
import com.controls.cdl.model.DataType;
import com.controls.cdl.model.Endpoint;
import com.controls.cdl.model.InstancePath;
import com.controls.cdl.model.Parameter;
import com.controls.cdl.model.ParentParameter;
import com.controls.cdl.registry.ImplementationRegistry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import lombok.extern.log4j.Log4j2;

/**
 * Checks a model's structural and semantic rules and reports every violation.
 *
 * <p>
 * The model is walked instance by instance from the root, so a block
 * definition used in several places is checked in each place with that
 * instance's parameter values, and findings carry the qualified path of the
 * instance they concern. Checking never stops at the first problem.
 *
 * <p>
 * The root instance's inputs are supplied from outside the model and are
 * never reported as unconnected. Inputs of every inner instance must be the
 * destination of exactly one connection; each composite output must be driven
 * by exactly one child output.
 *
 * <p>
 * Stateless apart from its registry and options; one validator may check any
 * number of models.
 */
@Log4j2
public final class SemanticValidator {
    private final ImplementationRegistry registry;
    private final EngineOptions options;

    public SemanticValidator(ImplementationRegistry registry) {
        this(registry, EngineOptions.defaults());
    }

    public SemanticValidator(ImplementationRegistry registry, EngineOptions options) {
        this.registry = registry;
        this.options = options;
    }

    /** Validates a block run as a model root, named after its type. */
    public ValidationReport validate(Block block) {
        return validate(BlockInstance.of(block.simpleName(), block));
    }

    public ValidationReport validate(BlockInstance root) {
        return validate(InstancePath.root(root.name()), root);
    }

    public ValidationReport validate(InstancePath rootPath, BlockInstance root) {
        ValidationReport.Builder report = ValidationReport.builder();
        checkInstance(rootPath, root, null, report);
        ValidationReport r = report.build();
        log.debug("Validated {}: {}", rootPath, r);
        return r;
    }

    /**
     * @param enclosing resolved parameter values of the enclosing instance, or
     *                  null at the root
     */
    private void checkInstance(InstancePath path, BlockInstance instance, Map<String, Object> enclosing,
            ValidationReport.Builder report) {
        Block block = instance.block();
        checkDefinition(path, block, report);
        Map<String, Object> resolved = checkParameters(path, instance, enclosing, report);

        if (block.isElementary()) {
            if (!registry.contains(block.typeName()))
                report.error(ValidationRule.UNKNOWN_BLOCK_TYPE, path.toString(),
                        "No implementation registered for block type " + block.typeName());
            return;
        }
        checkComposite(path, block, resolved, report);
    }

    private void checkDefinition(InstancePath path, Block block, ValidationReport.Builder report) {
        String loc = path.toString();
        duplicates(block.inputs().stream().map(Connector::name).collect(Collectors.toList()))
                .forEach(n -> report.error(ValidationRule.DUPLICATE_NAME, loc, "Duplicate input name '" + n + "'"));
        duplicates(block.outputs().stream().map(Connector::name).collect(Collectors.toList()))
                .forEach(n -> report.error(ValidationRule.DUPLICATE_NAME, loc, "Duplicate output name '" + n + "'"));
        duplicates(block.parameters().stream().map(Parameter::name).collect(Collectors.toList()))
                .forEach(n -> report.error(ValidationRule.DUPLICATE_NAME, loc, "Duplicate parameter name '" + n + "'"));

        Set<String> inputNames = new HashSet<>();
        for (Connector c : block.inputs())
            inputNames.add(c.name());
        for (Connector c : block.outputs())
            if (inputNames.contains(c.name()))
                report.warning(ValidationRule.NAME_CONFLICT, loc,
                        "Input and output share the name '" + c.name() + "'");

        for (Connector c : block.inputs())
            checkStart(path, c, report);
        for (Connector c : block.outputs())
            checkStart(path, c, report);
    }

    private void checkStart(InstancePath path, Connector c, ValidationReport.Builder report) {
        String loc = path + "." + c.name();
        if (!c.allowedValues().isEmpty() && c.type() != DataType.ENUMERATION && c.type() != DataType.STRING)
            report.error(ValidationRule.START_VALUE, loc,
                    "Allowed literals declared on a " + c.type().cdlName() + " connector");
        if (!c.hasStart())
            return;
        Object v;
        try {
            v = c.type().normalize(c.start());
        } catch (IllegalArgumentException e) {
            report.error(ValidationRule.START_VALUE, loc, "Start value: " + e.getMessage());
            return;
        }
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (c.min() != null && d < c.min())
                report.error(ValidationRule.START_VALUE, loc, "Start value " + v + " is less than minimum " + c.min());
            if (c.max() != null && d > c.max())
                report.error(ValidationRule.START_VALUE, loc,
                        "Start value " + v + " is greater than maximum " + c.max());
            if (v instanceof Double dv && !Double.isFinite(dv) && !options.isAllowNonFiniteReals())
                report.error(ValidationRule.START_VALUE, loc, "Start value " + v + " is not finite");
        }
        if (!c.allowedValues().isEmpty() && !c.allowedValues().contains(v))
            report.error(ValidationRule.START_VALUE, loc,
                    "Start value '" + v + "' is not one of " + c.allowedValues());
    }

    /** Resolves parameter values the way a context binds them, reporting every problem. */
    private Map<String, Object> checkParameters(InstancePath path, BlockInstance instance,
            Map<String, Object> enclosing, ValidationReport.Builder report) {
        Block block = instance.block();
        String loc = path.toString();
        for (String name : instance.overrides().keySet())
            if (block.parameter(name).isEmpty())
                report.error(ValidationRule.DANGLING_REFERENCE, loc,
                        "Override of unknown parameter '" + name + "' on " + block.typeName());

        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Parameter p : block.parameters()) {
            boolean overridden = instance.overrides().containsKey(p.name());
            Object raw = overridden ? instance.overrides().get(p.name()) : p.defaultValue();
            if (raw instanceof ParentParameter ref) {
                if (enclosing == null) {
                    report.error(ValidationRule.DANGLING_REFERENCE, loc, "Parameter '" + p.name()
                            + "' refers to enclosing parameter '" + ref.name() + "' but " + path
                            + " has no enclosing instance");
                    resolved.put(p.name(), null);
                    continue;
                }
                if (!enclosing.containsKey(ref.name())) {
                    report.error(ValidationRule.DANGLING_REFERENCE, loc, "Parameter '" + p.name()
                            + "' refers to unknown enclosing parameter '" + ref.name() + "'");
                    resolved.put(p.name(), null);
                    continue;
                }
                raw = enclosing.get(ref.name());
                if (raw == null) {
                    // already reported on the enclosing instance
                    resolved.put(p.name(), null);
                    continue;
                }
            }
            if (raw == null) {
                report.error(ValidationRule.MISSING_PARAMETER, loc,
                        "Required parameter '" + p.name() + "' of " + block.typeName() + " is not set");
                resolved.put(p.name(), null);
                continue;
            }
            if (!p.type().accepts(raw)) {
                report.error(ValidationRule.PARAMETER_TYPE, loc, "Parameter '" + p.name() + "' expects "
                        + p.type().cdlName() + ", got " + raw.getClass().getSimpleName() + " (" + raw + ")");
                resolved.put(p.name(), null);
                continue;
            }
            String problem = p.check(raw);
            if (problem != null) {
                report.error(ValidationRule.PARAMETER_BOUNDS, loc, problem);
                resolved.put(p.name(), null);
                continue;
            }
            resolved.put(p.name(), p.type().normalize(raw));
        }
        return resolved;
    }

    private void checkComposite(InstancePath path, Block block, Map<String, Object> resolved,
            ValidationReport.Builder report) {
        String loc = path.toString();

        // 1. Unique children
        Map<String, BlockInstance> children = new LinkedHashMap<>();
        for (BlockInstance child : block.children()) {
            if (children.putIfAbsent(child.name(), child) != null)
                report.error(ValidationRule.DUPLICATE_NAME, loc, "Duplicate instance name '" + child.name() + "'");
        }

        // 2. Resolve connections
        List<Connection> resolvable = new ArrayList<>();
        Map<Endpoint, List<Connection>> byDestination = new LinkedHashMap<>();
        Set<String> usedInputs = new HashSet<>();
        for (Connection c : block.connections()) {
            if (c.shape() == Connection.Shape.ILLEGAL) {
                report.error(ValidationRule.ILLEGAL_CONNECTION, loc,
                        "Connection " + c + " joins two connectors of the composite itself");
                continue;
            }
            Optional<Connector> source = resolveEnd(path, block, children, c, c.from(), true, report);
            Optional<Connector> destination = resolveEnd(path, block, children, c, c.to(), false, report);
            if (source.isEmpty() || destination.isEmpty())
                continue;
            resolvable.add(c);
            byDestination.computeIfAbsent(c.to(), k -> new ArrayList<>()).add(c);
            if (c.from().isBoundary())
                usedInputs.add(c.from().connector());

            DataType from = source.get().type();
            DataType to = destination.get().type();
            if (!options.isCompatible(from, to))
                report.error(ValidationRule.TYPE_MISMATCH, loc, "Connection " + c + " carries " + from.cdlName()
                        + " into " + to.cdlName());
        }

        // 3. Single assignment
        for (Map.Entry<Endpoint, List<Connection>> e : byDestination.entrySet()) {
            if (e.getValue().size() > 1)
                report.error(ValidationRule.MULTIPLE_ASSIGNMENT, qualify(path, e.getKey()),
                        e.getValue().size() + " connections drive " + e.getKey() + ": " + e.getValue());
        }
        for (BlockInstance child : children.values()) {
            for (Connector in : child.block().inputs()) {
                if (!byDestination.containsKey(Endpoint.of(child.name(), in.name())))
                    report.error(ValidationRule.UNCONNECTED_INPUT, path.child(child.name()) + "." + in.name(),
                            "Input '" + in.name() + "' of " + child.name() + " is not connected");
            }
        }
        for (Connector out : block.outputs()) {
            if (!byDestination.containsKey(Endpoint.boundary(out.name())))
                report.error(ValidationRule.UNDRIVEN_OUTPUT, loc + "." + out.name(),
                        "Output '" + out.name() + "' is not driven by any child output");
        }
        for (Connector in : block.inputs()) {
            if (!usedInputs.contains(in.name()))
                report.warning(ValidationRule.UNUSED_INPUT, loc + "." + in.name(),
                        "Input '" + in.name() + "' feeds no child");
        }

        // 4. Acyclicity
        DependencyGraph graph = DependencyGraph.of(path, new ArrayList<>(children.values()), resolvable);
        for (List<InstancePath> cycle : Scheduler.findCycles(graph)) {
            String members = cycle.stream().map(InstancePath::toString).collect(Collectors.joining(", "));
            report.error(ValidationRule.ALGEBRAIC_LOOP, members,
                    "Algebraic loop: " + AlgebraicLoopException.render(cycle));
        }

        // 5. Children, recursively
        for (BlockInstance child : children.values())
            checkInstance(path.child(child.name()), child, resolved, report);
    }

    /**
     * Finds the connector an endpoint names, checking it has the causality its
     * end of the connection requires.
     */
    private Optional<Connector> resolveEnd(InstancePath path, Block block, Map<String, BlockInstance> children,
            Connection c, Endpoint end, boolean isSource, ValidationReport.Builder report) {
        String loc = path.toString();
        Block owner;
        if (end.isBoundary()) {
            owner = block;
        } else {
            BlockInstance child = children.get(end.instance());
            if (child == null) {
                report.error(ValidationRule.DANGLING_REFERENCE, loc,
                        "Connection " + c + " refers to unknown instance '" + end.instance() + "'");
                return Optional.empty();
            }
            owner = child.block();
        }
        // Boundary sources and child destinations are inputs, the other ends outputs
        boolean wantInput = end.isBoundary() == isSource;
        Optional<Connector> wanted = wantInput ? owner.input(end.connector()) : owner.output(end.connector());
        if (wanted.isPresent())
            return wanted;
        Optional<Connector> other = wantInput ? owner.output(end.connector()) : owner.input(end.connector());
        if (other.isPresent())
            report.error(ValidationRule.ILLEGAL_CONNECTION, loc, "Connection " + c + " uses " + end + " as a "
                    + (isSource ? "source" : "destination") + " but it is an " + (wantInput ? "output" : "input"));
        else
            report.error(ValidationRule.DANGLING_REFERENCE, loc,
                    "Connection " + c + " refers to unknown connector " + end);
        return Optional.empty();
    }

    private static String qualify(InstancePath path, Endpoint e) {
        return e.isBoundary() ? path + "." + e.connector() : path.child(e.instance()) + "." + e.connector();
    }

    private static Set<String> duplicates(List<String> names) {
        Set<String> seen = new HashSet<>();
        Set<String> dup = new LinkedHashSet<>();
        for (String n : names)
            if (!seen.add(n))
                dup.add(n);
        return dup;
    }
}
