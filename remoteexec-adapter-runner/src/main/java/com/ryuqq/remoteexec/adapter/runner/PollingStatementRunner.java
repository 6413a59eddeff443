package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.application.poll.PollLoop;
import com.ryuqq.remoteexec.application.statement.StatementRunner;
import com.ryuqq.remoteexec.core.exception.ErrorKind;
import com.ryuqq.remoteexec.core.exception.RemoteExecutionException;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.model.OperationKind;
import com.ryuqq.remoteexec.core.model.ResultPage;
import com.ryuqq.remoteexec.core.model.StatementExecution;
import com.ryuqq.remoteexec.core.outcome.Cancelled;
import com.ryuqq.remoteexec.core.outcome.Fail;
import com.ryuqq.remoteexec.core.outcome.Ok;
import com.ryuqq.remoteexec.core.poll.CancellationSignal;
import com.ryuqq.remoteexec.core.poll.PollConfig;
import com.ryuqq.remoteexec.core.poll.PollResult;
import com.ryuqq.remoteexec.core.request.StatementRequest;
import com.ryuqq.remoteexec.core.snapshot.StatementSnapshot;
import com.ryuqq.remoteexec.core.spi.GatewayException;
import com.ryuqq.remoteexec.core.spi.RemoteOperationGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 폴링 기반 {@link StatementRunner} 구현체.
 *
 * <p><strong>결과 매핑:</strong></p>
 * <ul>
 *   <li>SUCCEEDED → Ok(첫 페이지) + 다음 페이지 토큰</li>
 *   <li>FAILED → Fail(플랫폼 오류 코드 또는 STATEMENT_FAILED)</li>
 *   <li>CANCELED → Cancelled</li>
 *   <li>CLOSED → Fail(STATEMENT_CLOSED)</li>
 * </ul>
 *
 * <p>페이지 이동은 자동으로 따라가지 않으며, 호출자가 {@link #fetchNextPage}로 이어서 읽습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class PollingStatementRunner implements StatementRunner {

    private static final Logger log = LoggerFactory.getLogger(PollingStatementRunner.class);

    private final RemoteOperationGateway gateway;
    private final PollLoop pollLoop;
    private final HandleLedger<StatementExecution> ledger;
    private final String defaultWarehouseId;

    /**
     * 생성자.
     *
     * @param gateway Remote Operation Gateway
     * @param pollLoop Poll Loop
     * @param ledger 핸들 저장소
     * @param defaultWarehouseId 기본 웨어하우스 ID (null 가능)
     * @throws IllegalArgumentException gateway, pollLoop, ledger가 null인 경우
     */
    public PollingStatementRunner(
        RemoteOperationGateway gateway,
        PollLoop pollLoop,
        HandleLedger<StatementExecution> ledger,
        String defaultWarehouseId
    ) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (pollLoop == null) {
            throw new IllegalArgumentException("pollLoop cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        this.gateway = gateway;
        this.pollLoop = pollLoop;
        this.ledger = ledger;
        this.defaultWarehouseId = defaultWarehouseId == null || defaultWarehouseId.isBlank() ? null : defaultWarehouseId;
    }

    @Override
    public StatementExecution submit(StatementRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        StatementRequest effective = request;
        if (!effective.hasWarehouse()) {
            if (defaultWarehouseId == null) {
                throw new IllegalArgumentException("warehouseId cannot be null or blank (no default warehouse configured)");
            }
            effective = effective.withWarehouseId(defaultWarehouseId);
        }

        OperationHandle handle;
        try {
            handle = gateway.submit(effective);
        } catch (GatewayException e) {
            throw new RemoteExecutionException(failureKind(e), null,
                "Failed to submit statement to warehouse " + effective.warehouseId() + ": " + e.getMessage(), e);
        }
        ledger.register(handle);
        log.info("Statement {} submitted to warehouse {}: {}",
            handle.getOperationId(), effective.warehouseId(), LogText.truncate(effective.statement()));
        return StatementExecution.pending(handle);
    }

    @Override
    public StatementExecution awaitCompletion(OperationHandle handle, PollConfig config, CancellationSignal signal) {
        requireStatementHandle(handle);
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        ledger.requireUsable(handle);

        StatementExecution recorded = ledger.terminalOrNull(handle);
        if (recorded != null) {
            return recorded;
        }
        ledger.register(handle);

        PollResult<StatementSnapshot> result = pollLoop.await(
            handle, StatementSnapshot.class, StatementSnapshot::isTerminal, config, signal);

        if (result instanceof PollResult.Terminal<StatementSnapshot> terminal) {
            StatementExecution execution = toExecution(handle, terminal.snapshot());
            StatementExecution stored = ledger.recordTerminal(handle, execution);
            if (stored == execution) {
                log.info("Statement {} finished: {} in {} ms",
                    handle.getOperationId(), execution.state(), result.elapsedMs());
            }
            return stored;
        }
        throw PollFailures.toException(result, handle, config, ErrorKind.NOT_FOUND);
    }

    @Override
    public ResultPage fetchNextPage(OperationHandle handle, String pageToken) {
        requireStatementHandle(handle);
        if (pageToken == null || pageToken.isBlank()) {
            throw new IllegalArgumentException("pageToken cannot be null or blank");
        }
        ledger.requireUsable(handle);
        try {
            ResultPage page = gateway.fetchPage(handle, pageToken);
            log.debug("Statement {} page {} fetched: {} rows", handle.getOperationId(), page.chunkIndex(), page.rowCount());
            return page;
        } catch (GatewayException e) {
            throw new RemoteExecutionException(failureKind(e), handle,
                "Failed to fetch page " + pageToken + " of statement " + handle.getOperationId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean cancel(OperationHandle handle) {
        requireStatementHandle(handle);
        ledger.requireUsable(handle);
        if (ledger.terminalOrNull(handle) != null) {
            log.debug("Statement {} already finished, cancel ignored", handle.getOperationId());
            return false;
        }
        try {
            gateway.cancel(handle);
            log.info("Cancel requested for statement {}", handle.getOperationId());
            return true;
        } catch (GatewayException e) {
            log.warn("Failed to cancel statement {}: {}", handle.getOperationId(), e.toString());
            return false;
        }
    }

    @Override
    public void close(OperationHandle handle) {
        requireStatementHandle(handle);
        if (ledger.dispose(handle)) {
            log.debug("Statement {} closed", handle.getOperationId());
        }
    }

    @Override
    public StatementExecution execute(StatementRequest request, PollConfig config) {
        StatementExecution submitted = submit(request);
        return awaitCompletion(submitted.handle(), config, CancellationSignal.none());
    }

    private StatementExecution toExecution(OperationHandle handle, StatementSnapshot snapshot) {
        switch (snapshot.state()) {
            case SUCCEEDED: {
                ResultPage page = snapshot.firstPage() != null ? snapshot.firstPage() : ResultPage.empty();
                return new StatementExecution(handle, snapshot.state(), Ok.of(page), page.nextPageToken());
            }
            case FAILED: {
                String code = isBlank(snapshot.errorCode()) ? STATEMENT_FAILED : snapshot.errorCode();
                String message = isBlank(snapshot.errorMessage()) ? "Statement failed" : snapshot.errorMessage();
                return new StatementExecution(handle, snapshot.state(), Fail.of(code, message), null);
            }
            case CANCELED:
                return new StatementExecution(handle, snapshot.state(), Cancelled.of("Statement canceled"), null);
            case CLOSED:
                return new StatementExecution(handle, snapshot.state(),
                    Fail.of(STATEMENT_CLOSED, "Statement closed before its result was read"), null);
            default:
                throw new IllegalStateException("Not a terminal statement state: " + snapshot.state());
        }
    }

    private ErrorKind failureKind(GatewayException e) {
        if (e.isNotFound()) {
            return ErrorKind.NOT_FOUND;
        }
        return e.isTransient() ? ErrorKind.POLL_FAILED : ErrorKind.POLL_ABORTED;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private void requireStatementHandle(OperationHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (handle.getKind() != OperationKind.STATEMENT) {
            throw new IllegalArgumentException("handle must be a statement handle (kind: " + handle.getKind() + ")");
        }
    }
}
