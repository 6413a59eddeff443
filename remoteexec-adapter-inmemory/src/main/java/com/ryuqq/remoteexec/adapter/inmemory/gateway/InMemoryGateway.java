package com.ryuqq.remoteexec.adapter.inmemory.gateway;

import com.ryuqq.remoteexec.core.model.CommandOutput;
import com.ryuqq.remoteexec.core.model.CommandState;
import com.ryuqq.remoteexec.core.model.ContextState;
import com.ryuqq.remoteexec.core.model.JobRun;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.model.OperationKind;
import com.ryuqq.remoteexec.core.model.ResultPage;
import com.ryuqq.remoteexec.core.model.RunLifeCycleState;
import com.ryuqq.remoteexec.core.model.RunResultState;
import com.ryuqq.remoteexec.core.model.StatementState;
import com.ryuqq.remoteexec.core.request.CommandRequest;
import com.ryuqq.remoteexec.core.request.ContextRequest;
import com.ryuqq.remoteexec.core.request.StatementRequest;
import com.ryuqq.remoteexec.core.request.SubmitRequest;
import com.ryuqq.remoteexec.core.snapshot.CommandSnapshot;
import com.ryuqq.remoteexec.core.snapshot.ContextSnapshot;
import com.ryuqq.remoteexec.core.snapshot.RunSnapshot;
import com.ryuqq.remoteexec.core.snapshot.StatementSnapshot;
import com.ryuqq.remoteexec.core.snapshot.StatusSnapshot;
import com.ryuqq.remoteexec.core.spi.FailureType;
import com.ryuqq.remoteexec.core.spi.GatewayException;
import com.ryuqq.remoteexec.core.spi.RemoteOperationGateway;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link RemoteOperationGateway} for testing and reference purposes.
 *
 * <p>Simulates a compute platform by replaying scripted status sequences. Each handle owns a
 * script of snapshots; every {@link #fetchStatus} advances the script by one step. The last step
 * repeats forever, and a terminal step never advances.</p>
 *
 * <p><strong>Default Scripts:</strong></p>
 * <ul>
 *   <li><strong>Context:</strong> Pending → Running</li>
 *   <li><strong>Command:</strong> Running → Finished (empty text output)</li>
 *   <li><strong>Statement:</strong> RUNNING → SUCCEEDED (empty first page)</li>
 *   <li><strong>Run:</strong> must be registered with {@link #registerRun}</li>
 * </ul>
 *
 * <p><strong>Platform Rules Simulated:</strong></p>
 * <ul>
 *   <li>Unknown handles fail with NOT_FOUND</li>
 *   <li>A destroyed context and every command inside it fail with NOT_FOUND</li>
 *   <li>Destroying a context twice fails with NOT_FOUND the second time</li>
 *   <li>Cancelling a non-terminal operation makes its next status the cancelled state</li>
 * </ul>
 *
 * <p><strong>Fault Injection:</strong> {@link #failNextSubmit}, {@link #failNextFetch},
 * {@link #failNextDispose} queue one failure each for the next call of that operation.</p>
 *
 * <p><strong>Thread Safety:</strong> all state is guarded by this instance's monitor. The
 * {@link #onFetchStatus} hook runs outside the monitor so it may block or cancel waiters.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryGateway gateway = new InMemoryGateway();
 * gateway.enqueueCommandScript(
 *     CommandSnapshot.of("template", CommandState.RUNNING),
 *     new CommandSnapshot("template", CommandState.FINISHED, CommandOutput.text("{\"value\": 42}")));
 *
 * RemoteExecutionEngine engine = RemoteExecutionEngine.create(gateway);
 * engine.commands().runOnceAndWait("cluster-1", "print(42)", Language.PYTHON);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryGateway implements RemoteOperationGateway {

    private final AtomicInteger sequence = new AtomicInteger();

    private final Map<OperationHandle, Deque<StatusSnapshot>> scripts = new LinkedHashMap<>();
    private final Map<OperationHandle, Map<String, ResultPage>> pages = new HashMap<>();
    private final Set<OperationHandle> destroyedContexts = new HashSet<>();

    private final Deque<List<ContextState>> contextScripts = new ArrayDeque<>();
    private final Deque<List<CommandSnapshot>> commandScripts = new ArrayDeque<>();
    private final Deque<List<StatementSnapshot>> statementScripts = new ArrayDeque<>();

    private final Deque<SubmitFailure> submitFailures = new ArrayDeque<>();
    private final Deque<FailureType> fetchFailures = new ArrayDeque<>();
    private final Deque<FailureType> disposeFailures = new ArrayDeque<>();

    private final Map<OperationHandle, Integer> fetchCounts = new HashMap<>();
    private final Map<OperationHandle, Integer> disposeCounts = new HashMap<>();
    private final Map<OperationHandle, Integer> cancelCounts = new HashMap<>();
    private final List<SubmitRequest> submitted = new ArrayList<>();

    private volatile Consumer<OperationHandle> fetchHook = handle -> { };

    // ============================================================
    // Scripting
    // ============================================================

    /**
     * Scripts the states reported by the next created context.
     *
     * @param states context states in order (at least one)
     * @return this gateway
     */
    public synchronized InMemoryGateway enqueueContextScript(ContextState... states) {
        requireSteps(states);
        contextScripts.addLast(List.of(states));
        return this;
    }

    /**
     * Scripts the snapshots reported by the next submitted command.
     *
     * <p>The command id of each template is replaced by the id assigned at submit.</p>
     *
     * @param steps snapshot templates in order (at least one)
     * @return this gateway
     */
    public synchronized InMemoryGateway enqueueCommandScript(CommandSnapshot... steps) {
        requireSteps(steps);
        commandScripts.addLast(List.of(steps));
        return this;
    }

    /**
     * Scripts the snapshots reported by the next submitted statement.
     *
     * <p>The statement id of each template is replaced by the id assigned at submit.</p>
     *
     * @param steps snapshot templates in order (at least one)
     * @return this gateway
     */
    public synchronized InMemoryGateway enqueueStatementScript(StatementSnapshot... steps) {
        requireSteps(steps);
        statementScripts.addLast(List.of(steps));
        return this;
    }

    /**
     * Replaces the script of an existing handle.
     *
     * @param handle submitted handle
     * @param steps snapshots in order (at least one)
     * @return this gateway
     */
    public synchronized InMemoryGateway script(OperationHandle handle, StatusSnapshot... steps) {
        requireHandle(handle);
        requireSteps(steps);
        scripts.put(handle, new ArrayDeque<>(Arrays.asList(steps)));
        return this;
    }

    /**
     * Registers an already started job run.
     *
     * @param runId run id
     * @param states run states in order (at least one)
     * @return the run handle
     */
    public synchronized OperationHandle registerRun(String runId, JobRun... states) {
        requireSteps(states);
        OperationHandle handle = OperationHandle.run(runId);
        Deque<StatusSnapshot> script = new ArrayDeque<>();
        for (JobRun run : states) {
            script.addLast(new RunSnapshot(run));
        }
        scripts.put(handle, script);
        return handle;
    }

    /**
     * Registers a result page returned for {@code pageToken}.
     *
     * @param handle statement handle
     * @param pageToken token that selects the page
     * @param page page content
     * @return this gateway
     */
    public synchronized InMemoryGateway registerPage(OperationHandle handle, String pageToken, ResultPage page) {
        requireHandle(handle);
        if (handle.getKind() != OperationKind.STATEMENT) {
            throw new IllegalArgumentException("handle must be a statement handle (kind: " + handle.getKind() + ")");
        }
        if (pageToken == null || pageToken.isBlank()) {
            throw new IllegalArgumentException("pageToken cannot be null or blank");
        }
        if (page == null) {
            throw new IllegalArgumentException("page cannot be null");
        }
        pages.computeIfAbsent(handle, key -> new HashMap<>()).put(pageToken, page);
        return this;
    }

    // ============================================================
    // Fault injection
    // ============================================================

    public synchronized InMemoryGateway failNextSubmit(FailureType failureType) {
        submitFailures.addLast(new SubmitFailure(null, requireFailureType(failureType)));
        return this;
    }

    /**
     * Fails the next submit of the given kind only.
     *
     * @param kind operation kind whose next submit fails
     * @param failureType failure classification
     * @return this gateway
     */
    public synchronized InMemoryGateway failNextSubmit(OperationKind kind, FailureType failureType) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        submitFailures.addLast(new SubmitFailure(kind, requireFailureType(failureType)));
        return this;
    }

    public synchronized InMemoryGateway failNextFetch(FailureType failureType) {
        fetchFailures.addLast(requireFailureType(failureType));
        return this;
    }

    public synchronized InMemoryGateway failNextDispose(FailureType failureType) {
        disposeFailures.addLast(requireFailureType(failureType));
        return this;
    }

    /**
     * Installs a hook invoked at the start of every status call, outside the monitor.
     *
     * <p>Use it to simulate call latency or to cancel a waiter while its call is in flight.</p>
     *
     * @param hook hook receiving the polled handle
     * @return this gateway
     */
    public InMemoryGateway onFetchStatus(Consumer<OperationHandle> hook) {
        if (hook == null) {
            throw new IllegalArgumentException("hook cannot be null");
        }
        this.fetchHook = hook;
        return this;
    }

    // ============================================================
    // RemoteOperationGateway
    // ============================================================

    @Override
    public synchronized OperationHandle submit(SubmitRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        throwIfSubmitFails(request.kind());
        submitted.add(request);

        if (request instanceof ContextRequest contextRequest) {
            return submitContext(contextRequest);
        }
        if (request instanceof CommandRequest commandRequest) {
            return submitCommand(commandRequest);
        }
        if (request instanceof StatementRequest statementRequest) {
            return submitStatement(statementRequest);
        }
        throw new IllegalArgumentException("Unsupported request: " + request);
    }

    @Override
    public StatusSnapshot fetchStatus(OperationHandle handle) {
        requireHandle(handle);
        fetchHook.accept(handle);
        synchronized (this) {
            fetchCounts.merge(handle, 1, Integer::sum);
            throwIfQueued(fetchFailures, "fetch " + handle);
            requireReachable(handle);
            Deque<StatusSnapshot> script = scripts.get(handle);
            if (script == null) {
                throw notFound(handle);
            }
            StatusSnapshot current = script.peekFirst();
            if (script.size() > 1 && !current.isTerminal()) {
                script.pollFirst();
            }
            return current;
        }
    }

    @Override
    public synchronized ResultPage fetchPage(OperationHandle handle, String pageToken) {
        requireHandle(handle);
        if (handle.getKind() != OperationKind.STATEMENT) {
            throw new IllegalArgumentException("handle must be a statement handle (kind: " + handle.getKind() + ")");
        }
        throwIfQueued(fetchFailures, "fetch page " + pageToken + " of " + handle);
        Map<String, ResultPage> statementPages = pages.get(handle);
        ResultPage page = statementPages == null ? null : statementPages.get(pageToken);
        if (page == null) {
            throw notFound(handle);
        }
        return page;
    }

    @Override
    public synchronized void cancel(OperationHandle handle) {
        requireHandle(handle);
        cancelCounts.merge(handle, 1, Integer::sum);
        requireReachable(handle);
        Deque<StatusSnapshot> script = scripts.get(handle);
        if (script == null) {
            throw notFound(handle);
        }
        StatusSnapshot current = script.peekFirst();
        if (current.isTerminal()) {
            return;
        }
        script.clear();
        script.addLast(cancelledFrom(current));
    }

    @Override
    public synchronized void dispose(OperationHandle handle) {
        requireHandle(handle);
        disposeCounts.merge(handle, 1, Integer::sum);
        throwIfQueued(disposeFailures, "dispose " + handle);
        if (handle.getKind() != OperationKind.CONTEXT) {
            return;
        }
        if (!scripts.containsKey(handle) || !destroyedContexts.add(handle)) {
            throw notFound(handle);
        }
    }

    // ============================================================
    // Inspection
    // ============================================================

    public synchronized int fetchCount(OperationHandle handle) {
        return fetchCounts.getOrDefault(handle, 0);
    }

    public synchronized int disposeCount(OperationHandle handle) {
        return disposeCounts.getOrDefault(handle, 0);
    }

    public synchronized int cancelCount(OperationHandle handle) {
        return cancelCounts.getOrDefault(handle, 0);
    }

    public synchronized List<SubmitRequest> submittedRequests() {
        return List.copyOf(submitted);
    }

    /**
     * Handles of the given kind in the order they were created or registered.
     *
     * @param kind operation kind
     * @return handles, oldest first
     */
    public synchronized List<OperationHandle> handles(OperationKind kind) {
        List<OperationHandle> handles = new ArrayList<>();
        for (OperationHandle handle : scripts.keySet()) {
            if (handle.getKind() == kind) {
                handles.add(handle);
            }
        }
        return handles;
    }

    /**
     * Number of contexts created and not yet destroyed.
     */
    public synchronized int liveContextCount() {
        int count = 0;
        for (OperationHandle handle : scripts.keySet()) {
            if (handle.getKind() == OperationKind.CONTEXT && !destroyedContexts.contains(handle)) {
                count++;
            }
        }
        return count;
    }

    public synchronized boolean isDestroyed(OperationHandle contextHandle) {
        return destroyedContexts.contains(contextHandle);
    }

    // ============================================================
    // Internals
    // ============================================================

    private OperationHandle submitContext(ContextRequest request) {
        OperationHandle handle = OperationHandle.context(request.clusterId(), nextId("ctx"));
        List<ContextState> states = contextScripts.isEmpty()
            ? List.of(ContextState.PENDING, ContextState.RUNNING)
            : contextScripts.pollFirst();
        Deque<StatusSnapshot> script = new ArrayDeque<>();
        for (ContextState state : states) {
            String error = state == ContextState.ERROR ? "Context failed to start" : null;
            script.addLast(new ContextSnapshot(handle.getOperationId(), state, error));
        }
        scripts.put(handle, script);
        return handle;
    }

    private OperationHandle submitCommand(CommandRequest request) {
        OperationHandle contextHandle = OperationHandle.context(request.clusterId(), request.contextId());
        if (!scripts.containsKey(contextHandle) || destroyedContexts.contains(contextHandle)) {
            throw notFound(contextHandle);
        }
        OperationHandle handle = OperationHandle.command(request.clusterId(), request.contextId(), nextId("cmd"));
        List<CommandSnapshot> templates = commandScripts.isEmpty()
            ? List.of(CommandSnapshot.of("template", CommandState.RUNNING),
                new CommandSnapshot("template", CommandState.FINISHED, CommandOutput.text("")))
            : commandScripts.pollFirst();
        Deque<StatusSnapshot> script = new ArrayDeque<>();
        for (CommandSnapshot template : templates) {
            script.addLast(new CommandSnapshot(handle.getOperationId(), template.state(), template.output()));
        }
        scripts.put(handle, script);
        return handle;
    }

    private OperationHandle submitStatement(StatementRequest request) {
        if (!request.hasWarehouse()) {
            throw new GatewayException(FailureType.PERMANENT, "warehouse_id is required", 400, null);
        }
        OperationHandle handle = OperationHandle.statement(request.warehouseId(), nextId("st"));
        List<StatementSnapshot> templates = statementScripts.isEmpty()
            ? List.of(StatementSnapshot.of("template", StatementState.RUNNING),
                StatementSnapshot.succeeded("template", ResultPage.empty()))
            : statementScripts.pollFirst();
        Deque<StatusSnapshot> script = new ArrayDeque<>();
        for (StatementSnapshot template : templates) {
            script.addLast(new StatementSnapshot(handle.getOperationId(), template.state(), template.firstPage(),
                template.errorCode(), template.errorMessage()));
        }
        scripts.put(handle, script);
        return handle;
    }

    private StatusSnapshot cancelledFrom(StatusSnapshot current) {
        if (current instanceof ContextSnapshot context) {
            return context;
        }
        if (current instanceof CommandSnapshot command) {
            return CommandSnapshot.of(command.commandId(), CommandState.CANCELLED);
        }
        if (current instanceof StatementSnapshot statement) {
            return StatementSnapshot.of(statement.statementId(), StatementState.CANCELED);
        }
        RunSnapshot run = (RunSnapshot) current;
        return new RunSnapshot(new JobRun(run.run().runId(), RunLifeCycleState.TERMINATED,
            RunResultState.CANCELED, "Run cancelled"));
    }

    private void requireReachable(OperationHandle handle) {
        if (handle.getKind() == OperationKind.CONTEXT && destroyedContexts.contains(handle)) {
            throw notFound(handle);
        }
        if (handle.getKind() == OperationKind.COMMAND && destroyedContexts.contains(handle.contextHandle())) {
            throw new GatewayException(FailureType.NOT_FOUND,
                "ContextNotFound: context " + handle.getParentId() + " does not exist", 404, null);
        }
    }

    private void throwIfSubmitFails(OperationKind kind) {
        Iterator<SubmitFailure> iterator = submitFailures.iterator();
        while (iterator.hasNext()) {
            SubmitFailure failure = iterator.next();
            if (failure.kind() == null || failure.kind() == kind) {
                iterator.remove();
                throw new GatewayException(failure.type(), "Injected " + failure.type() + " failure on submit " + kind);
            }
        }
    }

    private void throwIfQueued(Deque<FailureType> failures, String operation) {
        FailureType failure = failures.pollFirst();
        if (failure != null) {
            throw new GatewayException(failure, "Injected " + failure + " failure on " + operation);
        }
    }

    private GatewayException notFound(OperationHandle handle) {
        return new GatewayException(FailureType.NOT_FOUND,
            "RESOURCE_DOES_NOT_EXIST: " + handle.getKind() + " " + handle.getOperationId() + " does not exist", 404, null);
    }

    private String nextId(String prefix) {
        return prefix + "-" + sequence.incrementAndGet();
    }

    private FailureType requireFailureType(FailureType failureType) {
        if (failureType == null) {
            throw new IllegalArgumentException("failureType cannot be null");
        }
        return failureType;
    }

    private void requireHandle(OperationHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
    }

    private void requireSteps(Object[] steps) {
        if (steps == null || steps.length == 0) {
            throw new IllegalArgumentException("steps cannot be null or empty");
        }
    }

    private record SubmitFailure(OperationKind kind, FailureType type) {
    }
}
