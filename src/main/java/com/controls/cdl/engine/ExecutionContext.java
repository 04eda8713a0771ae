package com.controls.cdl.engine;

import com.controls.cdl.api.EvaluationListener;
import com.controls.cdl.api.Snapshotable;
import com.controls.cdl.config.EngineOptions;
import com.controls.cdl.io.ContextSnapshot;
import com.controls.cdl.io.SnapshotDocument;
import com.controls.cdl.model.Block;
import com.controls.cdl.model.BlockInstance;
import com.controls.cdl.model.Connection;
import com.controls.cdl.model.Connector;
import com.controls.cdl.model.DataType;
import com.controls.cdl.model.Endpoint;
import com.controls.cdl.model.InstancePath;
import com.controls.cdl.model.SignalKey;
import com.controls.cdl.registry.ImplementationRegistry;
import com.controls.cdl.validation.SemanticValidator;
import com.controls.cdl.validation.ValidationException;
import com.controls.cdl.validation.ValidationIssue;
import com.controls.cdl.validation.ValidationReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Runs one instantiation of a block model.
 *
 * <p>
 * The context exclusively owns the signal table of its instance and of that
 * instance's direct children, the runtime state of every child, and the
 * cached evaluation order. Each composite child is run by a nested context
 * that the child's runtime owns; nested contexts share this context's
 * registry, options and listener but nothing mutable.
 *
 * <h3>Lifecycle</h3>
 * See {@link ContextState}. {@link #initialize()} validates the model and
 * refuses to proceed on any error, then schedules, binds parameters, creates
 * implementations and seeds start values. {@link #step()} evaluates the cached
 * order once. A failure aborts the step and faults the context; partial
 * writes remain readable and the step counter does not advance. Only
 * {@link #reset()} leaves the faulted state.
 *
 * <h3>Threading</h3>
 * Not thread-safe. A context must be driven by one thread at a time;
 * independent contexts share nothing mutable and may run in parallel.
 *
 * <h3>Re-validation</h3>
 * {@link #revalidate()} only reports. Instance-local state, including that of
 * stateful children inside composites, is discarded on {@link #reset()} and
 * replaced on {@link #restore}, never on re-validation.
 */
@Log4j2
public final class ExecutionContext {
    private final InstancePath rootPath;
    private final BlockInstance root;
    private final ImplementationRegistry registry;
    private final EngineOptions options;
    private final boolean nested;
    private final EventScope scope;
    private final SignalTable signals;
    private final BlockEvaluator evaluator = new BlockEvaluator();

    private ContextState state = ContextState.UNVALIDATED;
    private BoundParameters parameters;
    private DependencyGraph graph;
    private EvaluationOrder order;
    private List<InstanceRuntime> runtimes = List.of();
    private Map<String, InstanceRuntime> children = Map.of();
    private List<SignalTransfer> outputTransfers = List.of();
    private long stepCount;
    private Throwable fault;
    private EvaluationListener listener;

    public ExecutionContext(Block block, ImplementationRegistry registry) {
        this(block, registry, EngineOptions.defaults());
    }

    public ExecutionContext(Block block, ImplementationRegistry registry, EngineOptions options) {
        this(BlockInstance.of(block.simpleName(), block), registry, options);
    }

    /**
     * Creates a context for a root instance, whose overrides bind the root
     * block's parameters.
     */
    public ExecutionContext(BlockInstance root, ImplementationRegistry registry, EngineOptions options) {
        this(InstancePath.root(root.name()), root, registry, options, false);
    }

    private ExecutionContext(InstancePath rootPath, BlockInstance root, ImplementationRegistry registry,
            EngineOptions options, boolean nested) {
        this.rootPath = rootPath;
        this.root = Objects.requireNonNull(root, "root");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.options = Objects.requireNonNull(options, "options");
        this.nested = nested;
        this.scope = new EventScope(options.getEventHistoryLimit());
        this.signals = new SignalTable(options.isRecordHistory() ? new SignalHistory(options.getHistoryLimit()) : null);
    }

    /**
     * Validates the model and prepares it for stepping.
     *
     * @throws ValidationException    if validation reports any error; the
     *                                context stays {@code UNVALIDATED}
     * @throws IllegalStateException if the context was already initialized
     */
    public void initialize() {
        if (state != ContextState.UNVALIDATED)
            throw new IllegalStateException("Context " + rootPath + " is already initialized");

        ValidationReport report = new SemanticValidator(registry, options).validate(rootPath, root);
        for (ValidationIssue w : report.warnings())
            log.warn("{}", w);
        if (!report.isValid()) {
            log.warn("Model {} failed validation with {} error(s)", rootPath, report.errors().size());
            throw new ValidationException(report);
        }

        build(BoundParameters.bind(rootPath, root, null));
        state = ContextState.INITIALIZED;
        scope.record(ExecutionEvent.of(ExecutionEvent.Type.INITIALIZE, 0, root.block().typeName()));
        log.info("Initialized {} ({}): {} instance(s), order {}", rootPath, root.block().typeName(), order.size(),
                order);
    }

    private void build(BoundParameters params) {
        Block block = root.block();
        this.parameters = params;
        if (block.isElementary()) {
            order = new EvaluationOrder(List.of(rootPath));
            runtimes = List.of(InstanceRuntime.elementary(rootPath, root, params, List.of(),
                    registry.require(block.typeName())));
        } else {
            graph = DependencyGraph.of(rootPath, block);
            order = Scheduler.schedule(graph);

            // 1. Resolve connections
            Map<String, List<SignalTransfer>> inbound = new HashMap<>();
            List<SignalTransfer> outs = new ArrayList<>();
            for (Connection c : block.connections()) {
                SignalTransfer t = resolve(block, c);
                if (c.shape() == Connection.Shape.CHILD_TO_PARENT_OUTPUT)
                    outs.add(t);
                else
                    inbound.computeIfAbsent(c.to().instance(), k -> new ArrayList<>()).add(t);
            }

            // 2. Child runtimes in evaluation order
            List<InstanceRuntime> rts = new ArrayList<>(order.size());
            Map<String, InstanceRuntime> byName = new HashMap<>(order.size() * 2);
            for (InstancePath path : order.paths()) {
                BlockInstance child = block.child(path.name())
                        .orElseThrow(() -> new IllegalStateException("Scheduled unknown instance " + path));
                BoundParameters bound = BoundParameters.bind(path, child, params);
                List<SignalTransfer> in = inbound.getOrDefault(path.name(), List.of());
                InstanceRuntime rt = child.block().isComposite()
                        ? InstanceRuntime.composite(path, child, bound, in, nestedContext(path, child, bound))
                        : InstanceRuntime.elementary(path, child, bound, in, registry.require(child.block().typeName()));
                rts.add(rt);
                byName.put(path.name(), rt);
            }
            runtimes = Collections.unmodifiableList(rts);
            children = Collections.unmodifiableMap(byName);
            outputTransfers = List.copyOf(outs);
        }
        seedStartValues();
    }

    private ExecutionContext nestedContext(InstancePath path, BlockInstance child, BoundParameters bound) {
        ExecutionContext ctx = new ExecutionContext(path, child, registry, options, true);
        ctx.listener = listener;
        ctx.build(bound);
        ctx.state = ContextState.INITIALIZED;
        return ctx;
    }

    private SignalTransfer resolve(Block block, Connection c) {
        Endpoint from = c.from();
        Endpoint to = c.to();
        Connector source = from.isBoundary()
                ? block.input(from.connector()).orElseThrow(() -> unknownEndpoint(c, from))
                : childBlock(block, from).output(from.connector()).orElseThrow(() -> unknownEndpoint(c, from));
        Connector destination = to.isBoundary()
                ? block.output(to.connector()).orElseThrow(() -> unknownEndpoint(c, to))
                : childBlock(block, to).input(to.connector()).orElseThrow(() -> unknownEndpoint(c, to));
        return new SignalTransfer(SignalKey.of(pathOf(from), from.connector()), source.type(),
                SignalKey.of(pathOf(to), to.connector()), destination.type());
    }

    private Block childBlock(Block block, Endpoint e) {
        return block.child(e.instance())
                .orElseThrow(() -> new IllegalStateException("Unknown instance '" + e.instance() + "' in " + rootPath))
                .block();
    }

    private IllegalStateException unknownEndpoint(Connection c, Endpoint e) {
        return new IllegalStateException("Connection " + c + " in " + rootPath + " has no connector " + e);
    }

    private InstancePath pathOf(Endpoint e) {
        return e.isBoundary() ? rootPath : rootPath.child(e.instance());
    }

    private void seedStartValues() {
        seed(rootPath, root.block());
        for (InstanceRuntime rt : runtimes)
            if (!rt.path().equals(rootPath))
                seed(rt.path(), rt.block());
    }

    private void seed(InstancePath path, Block block) {
        for (Connector c : block.inputs())
            if (c.hasStart())
                signals.put(SignalKey.of(path, c.name()), c.type().normalize(c.start()), 0);
        for (Connector c : block.outputs())
            if (c.hasStart())
                signals.put(SignalKey.of(path, c.name()), c.type().normalize(c.start()), 0);
    }

    /**
     * Evaluates every instance once, in the cached order.
     *
     * @return the number of instances evaluated
     * @throws EvaluationException   if an instance fails; the context is then
     *                               {@code FAULTED}
     * @throws IllegalStateException if the context is not initialized, is
     *                               faulted, is already inside a step, or is
     *                               nested inside another context
     */
    public int step() {
        requireRoot("step");
        return runStep();
    }

    /**
     * Sets the given root inputs, then steps. All values are checked before
     * any is applied.
     */
    public int step(Map<String, Object> rootInputs) {
        requireRoot("step");
        requireSteppable();
        Map<String, Object> admitted = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : rootInputs.entrySet())
            admitted.put(e.getKey(), admitInput(e.getKey(), e.getValue()));
        for (Map.Entry<String, Object> e : admitted.entrySet())
            writeInput(e.getKey(), e.getValue());
        return runStep();
    }

    int runStep() {
        requireSteppable();
        final long current = stepCount + 1;
        scope.enterExclusive(ExecutionEvent.of(ExecutionEvent.Type.STEP, stepCount, rootPath.toString()));

        final EvaluationListener l = this.listener;
        final boolean hasListener = l != null;
        if (hasListener)
            l.onStepStart(rootPath, current);

        int evaluated = 0;
        boolean completed = false;
        try {
            for (int i = 0; i < runtimes.size(); i++) {
                InstanceRuntime rt = runtimes.get(i);
                long start = hasListener ? System.nanoTime() : 0;
                try {
                    evaluator.evaluate(rt, this, current);
                } catch (RuntimeException e) {
                    if (hasListener)
                        l.onInstanceError(current, i, rt.path(), e);
                    throw e;
                }
                evaluated++;
                if (hasListener)
                    l.onInstanceEvaluated(current, i, rt.path(), System.nanoTime() - start);
            }
            evaluator.publishOutputs(rootPath, outputTransfers, signals, current);

            stepCount = current;
            state = ContextState.STEPPING;
            completed = true;
            return evaluated;
        } catch (RuntimeException | Error e) {
            markFaulted(current, e);
            throw e;
        } finally {
            scope.exit();
            if (hasListener)
                l.onStepEnd(rootPath, current, evaluated, completed);
        }
    }

    private void markFaulted(long step, Throwable e) {
        state = ContextState.FAULTED;
        fault = e;
        if (nested)
            log.debug("Nested context {} faulted at step {}: {}", rootPath, step, e.getMessage());
        else
            log.error("Context {} faulted at step {}", rootPath, step, e);
    }

    /**
     * Discards all signal values and instance-local state, recursively, and
     * returns to {@code INITIALIZED} with start values seeded and the step
     * counter at zero. The model is not validated again.
     *
     * @throws IllegalStateException if the context is nested inside another
     *                               context
     */
    public void reset() {
        requireRoot("reset");
        resetState();
    }

    void resetState() {
        requireInitialized();
        if (scope.depth() > 0)
            throw new IllegalStateException("Cannot reset " + rootPath + " while a step is in progress");
        signals.clear();
        for (InstanceRuntime rt : runtimes)
            rt.reinstantiate();
        stepCount = 0;
        fault = null;
        state = ContextState.INITIALIZED;
        seedStartValues();
        scope.record(ExecutionEvent.of(ExecutionEvent.Type.RESET, 0, rootPath.toString()));
        if (nested)
            log.debug("Reset nested context {}", rootPath);
        else
            log.info("Reset {}", rootPath);
    }

    /**
     * Runs the validator against the model again and returns its report. The
     * runtime state of the context is left untouched.
     */
    public ValidationReport revalidate() {
        return new SemanticValidator(registry, options).validate(rootPath, root);
    }

    /**
     * Sets an input of the root instance. Inputs of inner instances are driven
     * by connections and cannot be set.
     *
     * @throws IllegalArgumentException if the instance is not the root, the
     *                                  input is unknown, or the value has the
     *                                  wrong type or is not admissible
     */
    public void setInput(InstancePath instance, String connector, Object value) {
        requireInitialized();
        if (!instance.equals(rootPath))
            throw new IllegalArgumentException("Only inputs of the root instance " + rootPath
                    + " can be set; " + instance + " is driven by connections");
        setInput(connector, value);
    }

    public void setInput(String instance, String connector, Object value) {
        setInput(InstancePath.parse(instance), connector, value);
    }

    /** Sets an input of the root instance. */
    public void setInput(String connector, Object value) {
        requireRoot("set inputs of");
        requireInitialized();
        writeInput(connector, admitInput(connector, value));
    }

    private Object admitInput(String name, Object value) {
        if (scope.depth() > 0)
            throw new IllegalStateException("Cannot set inputs of " + rootPath + " while a step is in progress");
        Connector c = root.block().input(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown input '" + name + "' on " + rootPath));
        Object v;
        try {
            v = c.type().normalize(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Input " + rootPath + "." + name + ": " + e.getMessage(), e);
        }
        String problem = BlockEvaluator.admissionProblem(c, v, options);
        if (problem != null)
            throw new IllegalArgumentException("Input " + rootPath + "." + name + ": " + problem);
        return v;
    }

    private void writeInput(String name, Object canonical) {
        SignalKey key = SignalKey.of(rootPath, name);
        signals.put(key, canonical, stepCount + 1);
        scope.record(ExecutionEvent.of(ExecutionEvent.Type.INPUT_CHANGE, stepCount, key + " = " + canonical));
    }

    /**
     * Reads the current value of any connector at any depth.
     *
     * @throws MissingSignalException   if the connector holds no value
     * @throws IllegalArgumentException if the instance or connector is unknown
     */
    public Object getOutput(InstancePath instance, String connector) {
        return findSignal(instance, connector)
                .orElseThrow(() -> new MissingSignalException(instance, stepCount, SignalKey.of(instance, connector)));
    }

    public Object getOutput(String instance, String connector) {
        return getOutput(InstancePath.parse(instance), connector);
    }

    /** Reads a connector of the root instance. */
    public Object getOutput(String connector) {
        return getOutput(rootPath, connector);
    }

    /** The current value of a connector, or empty if nothing is bound to it. */
    public Optional<Object> findSignal(InstancePath instance, String connector) {
        requireInitialized();
        ExecutionContext owner = owningContext(instance);
        owner.requireConnector(instance, connector);
        return Optional.ofNullable(owner.signals.get(SignalKey.of(instance, connector)));
    }

    /**
     * Values a connector took, oldest first, bounded by
     * {@link EngineOptions#getHistoryLimit()}.
     *
     * @throws IllegalStateException if history recording is disabled
     */
    public List<SignalSample> history(InstancePath instance, String connector) {
        requireInitialized();
        if (!options.isRecordHistory())
            throw new IllegalStateException("Signal history is not recorded; enable " + EngineOptions.RECORD_HISTORY);
        ExecutionContext owner = owningContext(instance);
        owner.requireConnector(instance, connector);
        return owner.signals.history().of(SignalKey.of(instance, connector));
    }

    /** The context whose table holds the connectors of {@code instance}. */
    private ExecutionContext owningContext(InstancePath instance) {
        if (instance.equals(rootPath))
            return this;
        if (rootPath.equals(instance.parent()) && children.containsKey(instance.name()))
            return this;
        if (rootPath.contains(instance) && instance.depth() > rootPath.depth() + 1) {
            InstanceRuntime rt = children.get(rootPath.childSegmentTowards(instance));
            if (rt != null && rt.isComposite())
                return rt.nested().owningContext(instance);
        }
        throw new IllegalArgumentException("Unknown instance: " + instance);
    }

    private void requireConnector(InstancePath instance, String connector) {
        Block b = instance.equals(rootPath) ? root.block() : children.get(instance.name()).block();
        if (b.connector(connector).isEmpty())
            throw new IllegalArgumentException("Unknown connector '" + connector + "' on " + instance);
    }

    /**
     * Captures the signal table at every depth, the step counters and the
     * state of every {@link Snapshotable} implementation.
     *
     * @throws IllegalStateException if the context is uninitialized, faulted or
     *                               inside a step
     */
    public ContextSnapshot snapshot() {
        requireInitialized();
        if (state == ContextState.FAULTED)
            throw new IllegalStateException("Cannot snapshot faulted context " + rootPath + "; reset it first");
        if (scope.depth() > 0)
            throw new IllegalStateException("Cannot snapshot " + rootPath + " while a step is in progress");
        SnapshotDocument doc = new SnapshotDocument();
        doc.setModelType(root.block().typeName());
        doc.setRoot(rootPath.toString());
        captureInto(doc);
        ContextSnapshot snapshot = ContextSnapshot.of(doc);
        log.debug("Captured {}", snapshot);
        return snapshot;
    }

    private void captureInto(SnapshotDocument doc) {
        String ctx = rootPath.toString();
        doc.getSteps().put(ctx, stepCount);
        for (Map.Entry<SignalKey, Object> e : signals.asMap().entrySet()) {
            SignalKey key = e.getKey();
            doc.getSignals().add(new SnapshotDocument.SignalEntry(ctx, key.instance().toString(), key.connector(),
                    connectorOf(key).type().name(), e.getValue()));
        }
        for (InstanceRuntime rt : runtimes) {
            if (rt.isComposite())
                rt.nested().captureInto(doc);
            else if (rt.function() instanceof Snapshotable s)
                doc.getInstanceStates().put(rt.path().toString(), s.snapshotState());
        }
    }

    private Connector connectorOf(SignalKey key) {
        Block b = key.instance().equals(rootPath) ? root.block() : children.get(key.instance().name()).block();
        return b.connector(key.connector())
                .orElseThrow(() -> new IllegalArgumentException("Unknown connector in snapshot: " + key));
    }

    public static ExecutionContext restore(Block block, ImplementationRegistry registry, ContextSnapshot snapshot) {
        return restore(block, registry, snapshot, EngineOptions.defaults());
    }

    public static ExecutionContext restore(Block block, ImplementationRegistry registry, ContextSnapshot snapshot,
            EngineOptions options) {
        return restore(BlockInstance.of(block.simpleName(), block), registry, snapshot, options);
    }

    /**
     * Builds and initializes a fresh context for {@code root}, then loads the
     * snapshot into it. Subsequent steps behave as those of the context the
     * snapshot was taken from.
     *
     * @throws IllegalArgumentException if the snapshot was taken from a
     *                                  different model or does not fit it
     * @throws ValidationException      if the model does not validate
     */
    public static ExecutionContext restore(BlockInstance root, ImplementationRegistry registry,
            ContextSnapshot snapshot, EngineOptions options) {
        SnapshotDocument doc = snapshot.document();
        if (!root.block().typeName().equals(doc.getModelType()))
            throw new IllegalArgumentException("Snapshot of " + doc.getModelType()
                    + " cannot be restored into " + root.block().typeName());
        ExecutionContext ctx = new ExecutionContext(root, registry, options);
        if (!ctx.rootPath.toString().equals(doc.getRoot()))
            throw new IllegalArgumentException("Snapshot root " + doc.getRoot() + " does not match " + ctx.rootPath);
        ctx.initialize();

        Set<String> known = new HashSet<>();
        Set<String> elementary = new HashSet<>();
        ctx.collectPaths(known, elementary);
        for (String path : doc.getSteps().keySet())
            if (!known.contains(path))
                throw new IllegalArgumentException("Snapshot refers to unknown context " + path);
        for (SnapshotDocument.SignalEntry e : doc.getSignals())
            if (!known.contains(e.getContext()))
                throw new IllegalArgumentException("Snapshot signal " + e.getInstance() + "." + e.getConnector()
                        + " refers to unknown context " + e.getContext());
        for (String path : doc.getInstanceStates().keySet())
            if (!elementary.contains(path))
                throw new IllegalArgumentException("Snapshot holds state for unknown instance " + path);

        ctx.apply(doc);
        ctx.scope.record(ExecutionEvent.of(ExecutionEvent.Type.RESTORE, ctx.stepCount, doc.getRoot()));
        log.info("Restored {} at step {}", ctx.rootPath, ctx.stepCount);
        return ctx;
    }

    private void collectPaths(Set<String> contexts, Set<String> elementary) {
        contexts.add(rootPath.toString());
        for (InstanceRuntime rt : runtimes) {
            if (rt.isComposite())
                rt.nested().collectPaths(contexts, elementary);
            else
                elementary.add(rt.path().toString());
        }
    }

    private void apply(SnapshotDocument doc) {
        String ctx = rootPath.toString();
        Long steps = doc.getSteps().get(ctx);
        if (steps == null)
            throw new IllegalArgumentException("Snapshot has no step counter for " + ctx);

        signals.clear();
        for (SnapshotDocument.SignalEntry e : doc.getSignals()) {
            if (!ctx.equals(e.getContext()))
                continue;
            SignalKey key = SignalKey.of(InstancePath.parse(e.getInstance()), e.getConnector());
            if (!key.instance().equals(rootPath) && !children.containsKey(key.instance().name()))
                throw new IllegalArgumentException("Snapshot refers to unknown instance " + key.instance());
            Connector c = connectorOf(key);
            signals.put(key, decodeValue(c, e), steps);
        }

        for (InstanceRuntime rt : runtimes) {
            if (rt.isComposite()) {
                rt.nested().apply(doc);
                continue;
            }
            Map<String, Object> saved = doc.getInstanceStates().get(rt.path().toString());
            if (saved == null)
                continue;
            if (!(rt.function() instanceof Snapshotable s))
                throw new IllegalArgumentException("Snapshot holds state for " + rt.path()
                        + " but its implementation is not snapshotable");
            s.restoreState(saved);
        }

        stepCount = steps;
        fault = null;
        state = steps > 0 ? ContextState.STEPPING : ContextState.INITIALIZED;
    }

    private static Object decodeValue(Connector c, SnapshotDocument.SignalEntry e) {
        if (e.getType() != null && DataType.fromString(e.getType()) != c.type())
            throw new IllegalArgumentException("Snapshot type " + e.getType() + " of " + e.getInstance() + "."
                    + e.getConnector() + " does not match declared " + c.type().cdlName());
        Object raw = e.getValue();
        // Jackson writes non-finite doubles as strings
        if (c.type() == DataType.REAL && raw instanceof String s)
            raw = Double.valueOf(s);
        return c.type().normalize(raw);
    }

    /**
     * Installs a listener on this context and every nested context.
     * Pass null to remove it.
     */
    public void setListener(EvaluationListener listener) {
        requireRoot("set the listener of");
        installListener(listener);
    }

    private void installListener(EvaluationListener listener) {
        this.listener = listener;
        for (InstanceRuntime rt : runtimes)
            if (rt.isComposite())
                rt.nested().installListener(listener);
    }

    /** Nested contexts are driven only by the step of the context owning them. */
    private void requireRoot(String action) {
        if (nested)
            throw new IllegalStateException("Cannot " + action + " nested context " + rootPath
                    + "; it is driven by its parent");
    }

    private void requireInitialized() {
        if (state == ContextState.UNVALIDATED)
            throw new IllegalStateException("Context " + rootPath + " is not initialized");
    }

    private void requireSteppable() {
        requireInitialized();
        if (state == ContextState.FAULTED)
            throw new IllegalStateException("Context " + rootPath + " is faulted; reset() is required", fault);
    }

    SignalTable signals() {
        return signals;
    }

    EngineOptions options() {
        return options;
    }

    public InstancePath rootPath() {
        return rootPath;
    }

    public Block block() {
        return root.block();
    }

    public ContextState state() {
        return state;
    }

    /** Completed steps since initialization or the last reset. */
    public long stepCount() {
        return stepCount;
    }

    /** The failure that faulted the context, or null. */
    public Throwable fault() {
        return fault;
    }

    /** The cached evaluation order; for an elementary root, just the root. */
    public EvaluationOrder evaluationOrder() {
        requireInitialized();
        return order;
    }

    /** Dependency graph of the root composite, or empty for an elementary root. */
    public Optional<DependencyGraph> dependencyGraph() {
        requireInitialized();
        return Optional.ofNullable(graph);
    }

    /** Bound parameters of the root instance. */
    public BoundParameters parameters() {
        requireInitialized();
        return parameters;
    }

    /** Bound parameters of the root or one of its direct children. */
    public BoundParameters parameters(InstancePath instance) {
        requireInitialized();
        if (instance.equals(rootPath))
            return parameters;
        ExecutionContext owner = owningContext(instance);
        return owner == this ? children.get(instance.name()).parameters() : owner.parameters(instance);
    }

    /** Definition of the root or of any instance below it. */
    public Block blockAt(InstancePath instance) {
        requireInitialized();
        ExecutionContext owner = owningContext(instance);
        return instance.equals(owner.rootPath) ? owner.root.block() : owner.children.get(instance.name()).block();
    }

    /**
     * The nested context running a composite child, if the child is one. It
     * can be inspected but not stepped, reset or fed inputs directly.
     */
    public Optional<ExecutionContext> nested(String childName) {
        InstanceRuntime rt = children.get(childName);
        return rt != null && rt.isComposite() ? Optional.of(rt.nested()) : Optional.empty();
    }

    /** Signals held by this context, in first-write order. Nested contexts hold their own. */
    public Map<SignalKey, Object> signalValues() {
        return signals.asMap();
    }

    /** Recent lifecycle events, oldest first. */
    public List<ExecutionEvent> events() {
        return scope.history();
    }

    /** Depth of the open-event stack; non-zero only while stepping. */
    public int eventDepth() {
        return scope.depth();
    }

    @Override
    public String toString() {
        return "ExecutionContext[" + rootPath + ", " + state + ", step " + stepCount + "]";
    }
}
