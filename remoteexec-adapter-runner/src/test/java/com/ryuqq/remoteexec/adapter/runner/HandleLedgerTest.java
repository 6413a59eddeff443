package com.ryuqq.remoteexec.adapter.runner;

import com.ryuqq.remoteexec.core.exception.ErrorKind;
import com.ryuqq.remoteexec.core.exception.RemoteExecutionException;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.statemachine.HandleState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * HandleLedger 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class HandleLedgerTest {

    private final HandleLedger<String> ledger = new HandleLedger<>();
    private final OperationHandle handle = OperationHandle.statement("wh-1", "st-1");

    @Test
    void recordTerminal_처음_기록하면_그대로_반환() {
        // given
        ledger.register(handle);

        // when
        String recorded = ledger.recordTerminal(handle, "first");

        // then
        assertThat(recorded).isEqualTo("first");
        assertThat(ledger.terminalOrNull(handle)).isEqualTo("first");
        assertThat(ledger.stateOf(handle)).isEqualTo(HandleState.TERMINAL);
    }

    @Test
    void recordTerminal_두번째_기록은_무시되고_기존_결과_반환() {
        // given
        ledger.register(handle);
        ledger.recordTerminal(handle, "first");

        // when
        String recorded = ledger.recordTerminal(handle, "second");

        // then
        assertThat(recorded).isEqualTo("first");
        assertThat(ledger.terminalOrNull(handle)).isEqualTo("first");
    }

    @Test
    void dispose_첫_호출만_true() {
        // given
        ledger.register(handle);

        // when & then
        assertThat(ledger.dispose(handle)).isTrue();
        assertThat(ledger.dispose(handle)).isFalse();
        assertThat(ledger.isDisposed(handle)).isTrue();
    }

    @Test
    void dispose_종료_결과를_버리고_DISPOSED_표식만_남김() {
        // given
        ledger.register(handle);
        ledger.recordTerminal(handle, "rows of the first page");

        // when
        ledger.dispose(handle);

        // then
        assertThat(ledger.stateOf(handle)).isEqualTo(HandleState.DISPOSED);
        assertThat(ledger.terminalOrNull(handle)).isNull();
        assertThat(ledger.size()).isEqualTo(1);
    }

    @Test
    void recordTerminal_등록되지_않은_핸들은_기록하지_않음() {
        // when
        String recorded = ledger.recordTerminal(handle, "late");

        // then
        assertThat(recorded).isEqualTo("late");
        assertThat(ledger.stateOf(handle)).isNull();
        assertThat(ledger.size()).isZero();
    }

    @Test
    void release_조건에_맞는_항목만_제거() {
        // given
        OperationHandle first = OperationHandle.command("cluster-1", "ctx-1", "cmd-1");
        OperationHandle second = OperationHandle.command("cluster-1", "ctx-1", "cmd-2");
        OperationHandle other = OperationHandle.command("cluster-1", "ctx-2", "cmd-3");
        ledger.register(first);
        ledger.register(second);
        ledger.register(other);
        ledger.recordTerminal(first, "done");

        // when
        int released = ledger.release(h -> "ctx-1".equals(h.getParentId()));

        // then
        assertThat(released).isEqualTo(2);
        assertThat(ledger.terminalOrNull(first)).isNull();
        assertThat(ledger.stateOf(second)).isNull();
        assertThat(ledger.stateOf(other)).isEqualTo(HandleState.ACTIVE);
    }

    @Test
    void 보존_한도를_넘으면_오래된_종료_항목부터_제거() {
        // given
        HandleLedger<String> bounded = new HandleLedger<>(2);
        OperationHandle active = OperationHandle.statement("wh-1", "st-active");
        bounded.register(active);

        // when
        for (int i = 1; i <= 3; i++) {
            OperationHandle finished = OperationHandle.statement("wh-1", "st-" + i);
            bounded.register(finished);
            bounded.recordTerminal(finished, "result-" + i);
        }

        // then
        assertThat(bounded.terminalOrNull(OperationHandle.statement("wh-1", "st-1"))).isNull();
        assertThat(bounded.terminalOrNull(OperationHandle.statement("wh-1", "st-2"))).isEqualTo("result-2");
        assertThat(bounded.terminalOrNull(OperationHandle.statement("wh-1", "st-3"))).isEqualTo("result-3");
        assertThat(bounded.stateOf(active)).isEqualTo(HandleState.ACTIVE);
        assertThat(bounded.size()).isEqualTo(3);
    }

    @Test
    void forgetActive_결과가_없는_항목만_제거() {
        // given
        OperationHandle finished = OperationHandle.statement("wh-1", "st-2");
        ledger.register(handle);
        ledger.register(finished);
        ledger.recordTerminal(finished, "done");

        // when
        ledger.forgetActive(handle);
        ledger.forgetActive(finished);

        // then
        assertThat(ledger.stateOf(handle)).isNull();
        assertThat(ledger.terminalOrNull(finished)).isEqualTo("done");
    }

    @Test
    void 보존_한도가_양수가_아니면_예외() {
        assertThatThrownBy(() -> new HandleLedger<String>(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxRetained must be positive");
    }

    @Test
    void requireUsable_폐기된_핸들이면_INVALID_HANDLE() {
        // given
        ledger.dispose(handle);

        // when & then
        assertThatThrownBy(() -> ledger.requireUsable(handle))
            .isInstanceOf(RemoteExecutionException.class)
            .satisfies(e -> assertThat(((RemoteExecutionException) e).getKind()).isEqualTo(ErrorKind.INVALID_HANDLE));
    }

    @Test
    void stateOf_등록되지_않은_핸들은_null() {
        assertThat(ledger.stateOf(handle)).isNull();
        assertThat(ledger.isDisposed(handle)).isFalse();
    }

    @Test
    void dispose_동시_호출에서도_한번만_true() throws Exception {
        // given
        ledger.register(handle);
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return ledger.dispose(handle);
                }));
            }

            // when
            start.countDown();
            int winners = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    winners++;
                }
            }

            // then
            assertThat(winners).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void register_null_핸들이면_예외() {
        assertThatThrownBy(() -> ledger.register(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("handle cannot be null");
    }
}
