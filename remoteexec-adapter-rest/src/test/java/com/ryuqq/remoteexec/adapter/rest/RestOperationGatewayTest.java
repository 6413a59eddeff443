package com.ryuqq.remoteexec.adapter.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.remoteexec.core.model.CommandState;
import com.ryuqq.remoteexec.core.model.ContextState;
import com.ryuqq.remoteexec.core.model.Language;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.model.OperationKind;
import com.ryuqq.remoteexec.core.model.ResultPage;
import com.ryuqq.remoteexec.core.model.RunLifeCycleState;
import com.ryuqq.remoteexec.core.model.RunResultState;
import com.ryuqq.remoteexec.core.model.StatementState;
import com.ryuqq.remoteexec.core.request.CommandRequest;
import com.ryuqq.remoteexec.core.request.ContextRequest;
import com.ryuqq.remoteexec.core.request.StatementRequest;
import com.ryuqq.remoteexec.core.snapshot.CommandSnapshot;
import com.ryuqq.remoteexec.core.snapshot.ContextSnapshot;
import com.ryuqq.remoteexec.core.snapshot.RunSnapshot;
import com.ryuqq.remoteexec.core.snapshot.StatementSnapshot;
import com.ryuqq.remoteexec.core.spi.FailureType;
import com.ryuqq.remoteexec.core.spi.GatewayException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * RestOperationGateway 테스트.
 *
 * <p>JDK HttpServer 스텁을 상대로 요청 형식, 응답 해석, 실패 분류를 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RestOperationGatewayTest {

    private static final String TOKEN = "dapi-test-token-123";

    private final ObjectMapper mapper = new ObjectMapper();

    private StubPlatformServer platform;
    private RestOperationGateway gateway;

    @BeforeEach
    void setUp() throws Exception {
        platform = StubPlatformServer.start();
        gateway = new RestOperationGateway(RestGatewayConfig.of(platform.baseUrl() + "/", TOKEN));
    }

    @AfterEach
    void tearDown() {
        platform.close();
    }

    private JsonNode lastBody() throws Exception {
        return mapper.readTree(platform.lastRequest().body());
    }

    // ============================================================
    // Context
    // ============================================================

    @Test
    void 컨텍스트_생성은_clusterId와_language를_POST() throws Exception {
        // given
        platform.respond("POST", "/api/1.2/contexts/create", 200, "{\"id\":\"ctx-1\"}");

        // when
        OperationHandle handle = gateway.submit(new ContextRequest("cluster-1", Language.PYTHON));

        // then
        assertThat(handle).isEqualTo(OperationHandle.context("cluster-1", "ctx-1"));
        JsonNode body = lastBody();
        assertThat(body.get("clusterId").asText()).isEqualTo("cluster-1");
        assertThat(body.get("language").asText()).isEqualTo("python");
    }

    @Test
    void 모든_요청은_Bearer_토큰과_User_Agent를_포함() {
        // given
        platform.respond("POST", "/api/1.2/contexts/create", 200, "{\"id\":\"ctx-1\"}");

        // when
        gateway.submit(new ContextRequest("cluster-1", Language.SQL));

        // then
        StubPlatformServer.RecordedRequest request = platform.lastRequest();
        assertThat(request.header("Authorization")).isEqualTo("Bearer " + TOKEN);
        assertThat(request.header("User-Agent")).isEqualTo(RestOperationGateway.USER_AGENT);
        assertThat(request.header("Content-Type")).isEqualTo("application/json");
    }

    @Test
    void 컨텍스트_상태_조회는_쿼리_파라미터로_식별() {
        // given
        platform.respond("GET", "/api/1.2/contexts/status", 200, "{\"id\":\"ctx-1\",\"status\":\"Running\"}");

        // when
        ContextSnapshot snapshot = (ContextSnapshot) gateway.fetchStatus(OperationHandle.context("cluster-1", "ctx-1"));

        // then
        assertThat(snapshot.state()).isEqualTo(ContextState.RUNNING);
        assertThat(platform.lastRequest().query()).isEqualTo("clusterId=cluster-1&contextId=ctx-1");
    }

    @Test
    void 컨텍스트_폐기는_destroy_호출() throws Exception {
        // given
        platform.respond("POST", "/api/1.2/contexts/destroy", 200, "{}");

        // when
        gateway.dispose(OperationHandle.context("cluster-1", "ctx-1"));

        // then
        JsonNode body = lastBody();
        assertThat(platform.lastRequest().path()).isEqualTo("/api/1.2/contexts/destroy");
        assertThat(body.get("contextId").asText()).isEqualTo("ctx-1");
    }

    @Test
    void 컨텍스트가_아닌_핸들의_폐기는_요청하지_않음() {
        // when
        gateway.dispose(OperationHandle.statement("wh-1", "st-1"));
        gateway.dispose(OperationHandle.run("42"));

        // then
        assertThat(platform.requests()).isEmpty();
    }

    // ============================================================
    // Command
    // ============================================================

    @Test
    void 커맨드_제출은_컨텍스트를_부모로_하는_핸들_반환() throws Exception {
        // given
        platform.respond("POST", "/api/1.2/commands/execute", 200, "{\"id\":\"cmd-7\"}");

        // when
        OperationHandle handle = gateway.submit(
            new CommandRequest("cluster-1", "ctx-1", "print(42)", Language.PYTHON));

        // then
        assertThat(handle.getKind()).isEqualTo(OperationKind.COMMAND);
        assertThat(handle.getParentId()).isEqualTo("ctx-1");
        assertThat(handle.getOperationId()).isEqualTo("cmd-7");
        assertThat(lastBody().get("command").asText()).isEqualTo("print(42)");
    }

    @Test
    void 커맨드_완료_결과_해석() {
        // given
        platform.respond("GET", "/api/1.2/commands/status", 200,
            "{\"id\":\"cmd-7\",\"status\":\"Finished\",\"results\":{\"resultType\":\"text\",\"data\":\"{\\\"value\\\": 42}\"}}");

        // when
        CommandSnapshot snapshot = (CommandSnapshot) gateway.fetchStatus(
            OperationHandle.command("cluster-1", "ctx-1", "cmd-7"));

        // then
        assertThat(snapshot.state()).isEqualTo(CommandState.FINISHED);
        assertThat(snapshot.output().resultType()).isEqualTo("text");
        assertThat(snapshot.output().data()).isEqualTo("{\"value\": 42}");
        assertThat(platform.lastRequest().query()).isEqualTo("clusterId=cluster-1&commandId=cmd-7&contextId=ctx-1");
    }

    @Test
    void 커맨드_오류_결과는_summary와_cause_보존() {
        // given
        platform.respond("GET", "/api/1.2/commands/status", 200,
            "{\"id\":\"cmd-7\",\"status\":\"Finished\",\"results\":{\"resultType\":\"error\","
                + "\"summary\":\"NameError\",\"cause\":\"name 'x' is not defined\"}}");

        // when
        CommandSnapshot snapshot = (CommandSnapshot) gateway.fetchStatus(
            OperationHandle.command("cluster-1", "ctx-1", "cmd-7"));

        // then
        assertThat(snapshot.output().isError()).isTrue();
        assertThat(snapshot.output().summary()).isEqualTo("NameError");
        assertThat(snapshot.output().cause()).isEqualTo("name 'x' is not defined");
    }

    @Test
    void 테이블_결과_데이터는_JSON_문자열로_보존() {
        // given
        platform.respond("GET", "/api/1.2/commands/status", 200,
            "{\"id\":\"cmd-7\",\"status\":\"Finished\",\"results\":{\"resultType\":\"table\",\"data\":[[1,\"a\"]]}}");

        // when
        CommandSnapshot snapshot = (CommandSnapshot) gateway.fetchStatus(
            OperationHandle.command("cluster-1", "ctx-1", "cmd-7"));

        // then
        assertThat(snapshot.output().data()).isEqualTo("[[1,\"a\"]]");
    }

    @Test
    void 실행_중_커맨드는_결과_없음() {
        // given
        platform.respond("GET", "/api/1.2/commands/status", 200, "{\"id\":\"cmd-7\",\"status\":\"Queued\"}");

        // when
        CommandSnapshot snapshot = (CommandSnapshot) gateway.fetchStatus(
            OperationHandle.command("cluster-1", "ctx-1", "cmd-7"));

        // then
        assertThat(snapshot.state()).isEqualTo(CommandState.PENDING);
        assertThat(snapshot.output()).isNull();
    }

    @Test
    void 커맨드_취소는_세_식별자를_POST() throws Exception {
        // given
        platform.respond("POST", "/api/1.2/commands/cancel", 200, "{}");

        // when
        gateway.cancel(OperationHandle.command("cluster-1", "ctx-1", "cmd-7"));

        // then
        JsonNode body = lastBody();
        assertThat(body.get("clusterId").asText()).isEqualTo("cluster-1");
        assertThat(body.get("contextId").asText()).isEqualTo("ctx-1");
        assertThat(body.get("commandId").asText()).isEqualTo("cmd-7");
    }

    // ============================================================
    // Statement
    // ============================================================

    @Test
    void 문장_제출은_비동기_INLINE_요청() throws Exception {
        // given
        platform.respond("POST", "/api/2.0/sql/statements", 200,
            "{\"statement_id\":\"st-1\",\"status\":{\"state\":\"PENDING\"}}");
        StatementRequest request = StatementRequest.of("SELECT * FROM t WHERE id = :id", "wh-1")
            .withCatalog("main")
            .withSchema("default")
            .withParameter("id", "7");

        // when
        OperationHandle handle = gateway.submit(request);

        // then
        assertThat(handle).isEqualTo(OperationHandle.statement("wh-1", "st-1"));
        JsonNode body = lastBody();
        assertThat(body.get("warehouse_id").asText()).isEqualTo("wh-1");
        assertThat(body.get("wait_timeout").asText()).isEqualTo("0s");
        assertThat(body.get("disposition").asText()).isEqualTo("INLINE");
        assertThat(body.get("catalog").asText()).isEqualTo("main");
        assertThat(body.get("schema").asText()).isEqualTo("default");
        assertThat(body.get("row_limit").asLong()).isEqualTo(StatementRequest.DEFAULT_ROW_LIMIT);
        assertThat(body.get("parameters").get(0).get("name").asText()).isEqualTo("id");
        assertThat(body.get("parameters").get(0).get("value").asText()).isEqualTo("7");
    }

    @Test
    void 성공한_문장은_첫_페이지와_다음_토큰을_포함() {
        // given
        platform.respond("GET", "/api/2.0/sql/statements/st-1", 200,
            "{\"statement_id\":\"st-1\",\"status\":{\"state\":\"SUCCEEDED\"},"
                + "\"manifest\":{\"schema\":{\"columns\":[{\"name\":\"n\"},{\"name\":\"label\"}]}},"
                + "\"result\":{\"chunk_index\":0,\"data_array\":[[\"1\",\"one\"],[\"2\",null]],\"next_chunk_index\":1}}");

        // when
        StatementSnapshot snapshot = (StatementSnapshot) gateway.fetchStatus(OperationHandle.statement("wh-1", "st-1"));

        // then
        assertThat(snapshot.state()).isEqualTo(StatementState.SUCCEEDED);
        ResultPage page = snapshot.firstPage();
        assertThat(page.columns()).containsExactly("n", "label");
        assertThat(page.rows()).hasSize(2);
        assertThat(page.rows().get(1).get(1)).isNull();
        assertThat(page.nextPageToken()).isEqualTo("1");
    }

    @Test
    void 다음_페이지는_청크_엔드포인트로_조회() {
        // given
        platform.respond("GET", "/api/2.0/sql/statements/st-1/result/chunks/1", 200,
            "{\"chunk_index\":1,\"data_array\":[[\"3\",\"three\"]]}");

        // when
        ResultPage page = gateway.fetchPage(OperationHandle.statement("wh-1", "st-1"), "1");

        // then
        assertThat(page.chunkIndex()).isEqualTo(1);
        assertThat(page.rows()).containsExactly(List.of("3", "three"));
        assertThat(page.hasMore()).isFalse();
    }

    @Test
    void 실패한_문장은_오류_코드와_메시지_보존() {
        // given
        platform.respond("GET", "/api/2.0/sql/statements/st-1", 200,
            "{\"statement_id\":\"st-1\",\"status\":{\"state\":\"FAILED\","
                + "\"error\":{\"error_code\":\"SYNTAX_ERROR\",\"message\":\"near FROM\"}}}");

        // when
        StatementSnapshot snapshot = (StatementSnapshot) gateway.fetchStatus(OperationHandle.statement("wh-1", "st-1"));

        // then
        assertThat(snapshot.state()).isEqualTo(StatementState.FAILED);
        assertThat(snapshot.errorCode()).isEqualTo("SYNTAX_ERROR");
        assertThat(snapshot.errorMessage()).isEqualTo("near FROM");
    }

    @Test
    void 문장_취소는_cancel_엔드포인트_호출() {
        // given
        platform.respond("POST", "/api/2.0/sql/statements/st-1/cancel", 200, "");

        // when
        gateway.cancel(OperationHandle.statement("wh-1", "st-1"));

        // then
        assertThat(platform.lastRequest().path()).isEqualTo("/api/2.0/sql/statements/st-1/cancel");
    }

    // ============================================================
    // Run
    // ============================================================

    @Test
    void 런_상태_조회() {
        // given
        platform.respond("GET", "/api/2.1/jobs/runs/get", 200,
            "{\"run_id\":42,\"state\":{\"life_cycle_state\":\"TERMINATED\",\"result_state\":\"SUCCESS\","
                + "\"state_message\":\"\"}}");

        // when
        RunSnapshot snapshot = (RunSnapshot) gateway.fetchStatus(OperationHandle.run("42"));

        // then
        assertThat(snapshot.run().lifeCycleState()).isEqualTo(RunLifeCycleState.TERMINATED);
        assertThat(snapshot.run().resultState()).isEqualTo(RunResultState.SUCCESS);
        assertThat(platform.lastRequest().query()).isEqualTo("run_id=42");
    }

    @Test
    void 알_수_없는_런_상태는_UNKNOWN() {
        // given
        platform.respond("GET", "/api/2.1/jobs/runs/get", 200,
            "{\"run_id\":42,\"state\":{\"life_cycle_state\":\"HIBERNATING\"}}");

        // when
        RunSnapshot snapshot = (RunSnapshot) gateway.fetchStatus(OperationHandle.run("42"));

        // then
        assertThat(snapshot.run().lifeCycleState()).isEqualTo(RunLifeCycleState.UNKNOWN);
        assertThat(snapshot.run().resultState()).isNull();
    }

    @Test
    void 런_취소는_숫자_run_id_전송() throws Exception {
        // given
        platform.respond("POST", "/api/2.1/jobs/runs/cancel", 200, "{}");

        // when
        gateway.cancel(OperationHandle.run("42"));

        // then
        JsonNode runId = lastBody().get("run_id");
        assertThat(runId.isNumber()).isTrue();
        assertThat(runId.asLong()).isEqualTo(42L);
    }

    // ============================================================
    // 실패 분류
    // ============================================================

    private GatewayException fetchContextFailure() {
        return catchThrowableOfType(
            () -> gateway.fetchStatus(OperationHandle.context("cluster-1", "ctx-1")), GatewayException.class);
    }

    @Test
    void 상태_404는_NOT_FOUND() {
        // given
        platform.respond("GET", "/api/1.2/contexts/status", 404,
            "{\"error_code\":\"RESOURCE_DOES_NOT_EXIST\",\"message\":\"gone\"}");

        // when
        GatewayException e = fetchContextFailure();

        // then
        assertThat(e.getFailureType()).isEqualTo(FailureType.NOT_FOUND);
        assertThat(e.getStatusCode()).isEqualTo(404);
    }

    @Test
    void ContextNotFound_오류는_상태_코드와_무관하게_NOT_FOUND() {
        // given
        platform.respond("GET", "/api/1.2/contexts/status", 400, "{\"error\":\"ContextNotFound: ctx-1\"}");

        // when
        GatewayException e = fetchContextFailure();

        // then
        assertThat(e.getFailureType()).isEqualTo(FailureType.NOT_FOUND);
    }

    @Test
    void 요청_한도와_서버_오류는_TRANSIENT() {
        // given
        platform.respond("GET", "/api/1.2/contexts/status", 429, "{\"error_code\":\"REQUEST_LIMIT_EXCEEDED\"}")
            .respond("GET", "/api/1.2/contexts/status", 503, "")
            .respond("GET", "/api/1.2/contexts/status", 408, "");

        // when & then
        assertThat(fetchContextFailure().getFailureType()).isEqualTo(FailureType.TRANSIENT);
        assertThat(fetchContextFailure().getFailureType()).isEqualTo(FailureType.TRANSIENT);
        assertThat(fetchContextFailure().getFailureType()).isEqualTo(FailureType.TRANSIENT);
    }

    @Test
    void 그_밖의_4xx는_PERMANENT() {
        // given
        platform.respond("GET", "/api/1.2/contexts/status", 403, "{\"error_code\":\"PERMISSION_DENIED\"}");

        // when
        GatewayException e = fetchContextFailure();

        // then
        assertThat(e.getFailureType()).isEqualTo(FailureType.PERMANENT);
        assertThat(e.getMessage()).contains("403").doesNotContain(TOKEN);
    }

    @Test
    void 해석할_수_없는_응답은_PERMANENT() {
        // given
        platform.respond("GET", "/api/1.2/contexts/status", 200, "<html>maintenance</html>");

        // when
        GatewayException e = fetchContextFailure();

        // then
        assertThat(e.getFailureType()).isEqualTo(FailureType.PERMANENT);
    }

    @Test
    void 알_수_없는_상태_값은_PERMANENT() {
        // given
        platform.respond("GET", "/api/1.2/contexts/status", 200, "{\"id\":\"ctx-1\",\"status\":\"Sleeping\"}");

        // when
        GatewayException e = fetchContextFailure();

        // then
        assertThat(e.getFailureType()).isEqualTo(FailureType.PERMANENT);
    }

    @Test
    void 응답에_id가_없으면_PERMANENT() {
        // given
        platform.respond("POST", "/api/1.2/contexts/create", 200, "{}");

        // when
        GatewayException e = catchThrowableOfType(
            () -> gateway.submit(new ContextRequest("cluster-1", Language.PYTHON)), GatewayException.class);

        // then
        assertThat(e.getFailureType()).isEqualTo(FailureType.PERMANENT);
    }

    @Test
    void 요청_타임아웃은_TRANSIENT() {
        // given
        RestOperationGateway impatient = new RestOperationGateway(
            RestGatewayConfig.of(platform.baseUrl(), TOKEN).withRequestTimeoutMs(200));
        platform.respondAfter("GET", "/api/1.2/contexts/status", 200, "{\"status\":\"Running\"}", 2_000);

        // when
        GatewayException e = catchThrowableOfType(
            () -> impatient.fetchStatus(OperationHandle.context("cluster-1", "ctx-1")), GatewayException.class);

        // then
        assertThat(e.getFailureType()).isEqualTo(FailureType.TRANSIENT);
        assertThat(e.getStatusCode()).isZero();
    }

    @Test
    void 연결_실패는_TRANSIENT() {
        // given
        String baseUrl = platform.baseUrl();
        platform.close();
        RestOperationGateway unreachable = new RestOperationGateway(RestGatewayConfig.of(baseUrl, TOKEN));

        // when
        GatewayException e = catchThrowableOfType(
            () -> unreachable.fetchStatus(OperationHandle.context("cluster-1", "ctx-1")), GatewayException.class);

        // then
        assertThat(e.getFailureType()).isEqualTo(FailureType.TRANSIENT);
    }
}
