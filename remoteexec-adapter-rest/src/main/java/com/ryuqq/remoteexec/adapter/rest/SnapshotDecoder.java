package com.ryuqq.remoteexec.adapter.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.remoteexec.core.model.CommandOutput;
import com.ryuqq.remoteexec.core.model.CommandState;
import com.ryuqq.remoteexec.core.model.ContextState;
import com.ryuqq.remoteexec.core.model.JobRun;
import com.ryuqq.remoteexec.core.model.ResultPage;
import com.ryuqq.remoteexec.core.model.RunLifeCycleState;
import com.ryuqq.remoteexec.core.model.RunResultState;
import com.ryuqq.remoteexec.core.model.StatementState;
import com.ryuqq.remoteexec.core.snapshot.CommandSnapshot;
import com.ryuqq.remoteexec.core.snapshot.ContextSnapshot;
import com.ryuqq.remoteexec.core.snapshot.RunSnapshot;
import com.ryuqq.remoteexec.core.snapshot.StatementSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * 플랫폼 JSON 응답을 타입이 있는 스냅샷으로 변환.
 *
 * <p>원시 JSON은 이 클래스 밖으로 나가지 않습니다. 필수 필드가 없거나 상태 값을 알 수 없으면
 * {@link IllegalArgumentException}을 던지며, 호출자가 PERMANENT 실패로 변환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class SnapshotDecoder {

    String decodeId(JsonNode root, String field) {
        String id = text(root, field);
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Response has no " + field);
        }
        return id;
    }

    /**
     * {@code GET /api/1.2/contexts/status} 응답.
     */
    ContextSnapshot decodeContext(String contextId, JsonNode root) {
        ContextState state = ContextState.fromWire(required(root, "status"));
        return new ContextSnapshot(contextId, state, text(root, "error"));
    }

    /**
     * {@code GET /api/1.2/commands/status} 응답.
     */
    CommandSnapshot decodeCommand(String commandId, JsonNode root) {
        CommandState state = CommandState.fromWire(required(root, "status"));
        JsonNode results = root.path("results");
        if (results.isMissingNode() || results.isNull() || !results.hasNonNull("resultType")) {
            return CommandSnapshot.of(commandId, state);
        }
        CommandOutput output = new CommandOutput(
            results.get("resultType").asText(),
            dataOf(results.path("data")),
            text(results, "summary"),
            text(results, "cause"));
        return new CommandSnapshot(commandId, state, output);
    }

    /**
     * {@code GET /api/2.0/sql/statements/{id}} 응답 (제출 응답도 같은 형식).
     */
    StatementSnapshot decodeStatement(String statementId, JsonNode root) {
        JsonNode status = root.path("status");
        StatementState state = StatementState.fromWire(required(status, "state"));
        if (state == StatementState.SUCCEEDED) {
            return StatementSnapshot.succeeded(statementId, decodeFirstPage(root));
        }
        JsonNode error = status.path("error");
        if (error.isMissingNode() || error.isNull()) {
            return StatementSnapshot.of(statementId, state);
        }
        return new StatementSnapshot(statementId, state, null, text(error, "error_code"), text(error, "message"));
    }

    /**
     * {@code GET /api/2.0/sql/statements/{id}/result/chunks/{n}} 응답.
     *
     * <p>청크 응답에는 스키마가 없으므로 컬럼은 비어 있습니다. 컬럼은 첫 페이지에만 있습니다.</p>
     */
    ResultPage decodeChunk(JsonNode chunk) {
        return new ResultPage(List.of(), rowsOf(chunk.path("data_array")), chunk.path("chunk_index").asInt(0),
            nextToken(chunk));
    }

    /**
     * {@code GET /api/2.1/jobs/runs/get} 응답.
     */
    RunSnapshot decodeRun(String runId, JsonNode root) {
        JsonNode state = root.path("state");
        RunLifeCycleState lifeCycleState = RunLifeCycleState.fromWire(text(state, "life_cycle_state"));
        RunResultState resultState = RunResultState.fromWire(text(state, "result_state"));
        return new RunSnapshot(new JobRun(runId, lifeCycleState, resultState, text(state, "state_message")));
    }

    private ResultPage decodeFirstPage(JsonNode root) {
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            return new ResultPage(columnsOf(root), List.of(), 0, null);
        }
        return new ResultPage(columnsOf(root), rowsOf(result.path("data_array")),
            result.path("chunk_index").asInt(0), nextToken(result));
    }

    private List<String> columnsOf(JsonNode root) {
        List<String> columns = new ArrayList<>();
        for (JsonNode column : root.path("manifest").path("schema").path("columns")) {
            columns.add(column.path("name").asText());
        }
        return columns;
    }

    private List<List<String>> rowsOf(JsonNode dataArray) {
        List<List<String>> rows = new ArrayList<>();
        for (JsonNode row : dataArray) {
            List<String> values = new ArrayList<>();
            for (JsonNode value : row) {
                values.add(value.isNull() ? null : value.asText());
            }
            rows.add(values);
        }
        return rows;
    }

    private String nextToken(JsonNode result) {
        if (!result.hasNonNull("next_chunk_index")) {
            return null;
        }
        return result.get("next_chunk_index").asText();
    }

    private String dataOf(JsonNode data) {
        if (data.isMissingNode() || data.isNull()) {
            return null;
        }
        // 표 형식 결과는 배열로 오므로 JSON 문자열 그대로 보존
        return data.isValueNode() ? data.asText() : data.toString();
    }

    private String required(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Response has no " + field);
        }
        return value;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
