package com.ryuqq.remoteexec.adapter.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.remoteexec.core.model.OperationHandle;
import com.ryuqq.remoteexec.core.model.OperationKind;
import com.ryuqq.remoteexec.core.model.ResultPage;
import com.ryuqq.remoteexec.core.request.CommandRequest;
import com.ryuqq.remoteexec.core.request.ContextRequest;
import com.ryuqq.remoteexec.core.request.StatementRequest;
import com.ryuqq.remoteexec.core.request.SubmitRequest;
import com.ryuqq.remoteexec.core.snapshot.StatusSnapshot;
import com.ryuqq.remoteexec.core.spi.GatewayException;
import com.ryuqq.remoteexec.core.spi.RemoteOperationGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * Databricks REST API 기반 {@link RemoteOperationGateway} 구현체.
 *
 * <p>각 메서드는 정확히 하나의 HTTP 요청을 보내며 재시도하지 않습니다.
 * 응답 JSON은 여기서 한 번만 해석되어 타입이 있는 스냅샷으로 반환됩니다.</p>
 *
 * <p><strong>엔드포인트:</strong></p>
 * <ul>
 *   <li>Context: {@code /api/1.2/contexts/create|status|destroy}</li>
 *   <li>Command: {@code /api/1.2/commands/execute|status|cancel}</li>
 *   <li>Statement: {@code /api/2.0/sql/statements}, {@code /{id}}, {@code /{id}/result/chunks/{n}},
 *       {@code /{id}/cancel}</li>
 *   <li>Run: {@code /api/2.1/jobs/runs/get}, {@code /api/2.1/jobs/runs/cancel}</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> {@link HttpClient}와 {@link ObjectMapper}는 thread-safe하며,
 * 이 클래스는 호출 사이에 상태를 유지하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RestOperationGateway implements RemoteOperationGateway {

    private static final Logger log = LoggerFactory.getLogger(RestOperationGateway.class);

    public static final String USER_AGENT = "remoteexec/1.0.0";

    static final String CONTEXTS_CREATE = "/api/1.2/contexts/create";
    static final String CONTEXTS_STATUS = "/api/1.2/contexts/status";
    static final String CONTEXTS_DESTROY = "/api/1.2/contexts/destroy";
    static final String COMMANDS_EXECUTE = "/api/1.2/commands/execute";
    static final String COMMANDS_STATUS = "/api/1.2/commands/status";
    static final String COMMANDS_CANCEL = "/api/1.2/commands/cancel";
    static final String STATEMENTS = "/api/2.0/sql/statements";
    static final String RUNS_GET = "/api/2.1/jobs/runs/get";
    static final String RUNS_CANCEL = "/api/2.1/jobs/runs/cancel";

    private final RestGatewayConfig config;
    private final HttpClient client;
    private final ObjectMapper mapper;
    private final SnapshotDecoder decoder;
    private final FailureClassifier classifier;

    public RestOperationGateway(RestGatewayConfig config) {
        this(config, HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofMillis(requireConfig(config).connectTimeoutMs()))
            .build());
    }

    RestOperationGateway(RestGatewayConfig config, HttpClient client) {
        this.config = requireConfig(config);
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
        this.mapper = new ObjectMapper();
        this.decoder = new SnapshotDecoder();
        this.classifier = new FailureClassifier(mapper);
    }

    public RestGatewayConfig config() {
        return config;
    }

    // ============================================================
    // submit
    // ============================================================

    @Override
    public OperationHandle submit(SubmitRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
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

    private OperationHandle submitContext(ContextRequest request) {
        ObjectNode body = mapper.createObjectNode()
            .put("clusterId", request.clusterId())
            .put("language", request.language().wireName());
        String contextId = post(CONTEXTS_CREATE, body, root -> decoder.decodeId(root, "id"));
        return OperationHandle.context(request.clusterId(), contextId);
    }

    private OperationHandle submitCommand(CommandRequest request) {
        ObjectNode body = mapper.createObjectNode()
            .put("clusterId", request.clusterId())
            .put("contextId", request.contextId())
            .put("command", request.code())
            .put("language", request.language().wireName());
        String commandId = post(COMMANDS_EXECUTE, body, root -> decoder.decodeId(root, "id"));
        return OperationHandle.command(request.clusterId(), request.contextId(), commandId);
    }

    private OperationHandle submitStatement(StatementRequest request) {
        if (!request.hasWarehouse()) {
            throw new IllegalArgumentException("warehouseId cannot be null or blank");
        }
        ObjectNode body = mapper.createObjectNode()
            .put("statement", request.statement())
            .put("warehouse_id", request.warehouseId())
            .put("wait_timeout", "0s")
            .put("disposition", "INLINE")
            .put("format", "JSON_ARRAY")
            .put("row_limit", request.rowLimit())
            .put("byte_limit", request.byteLimit());
        if (request.catalog() != null) {
            body.put("catalog", request.catalog());
        }
        if (request.schema() != null) {
            body.put("schema", request.schema());
        }
        if (!request.parameters().isEmpty()) {
            ArrayNode parameters = body.putArray("parameters");
            request.parameters().forEach((name, value) -> parameters.addObject().put("name", name).put("value", value));
        }
        String statementId = post(STATEMENTS, body, root -> decoder.decodeId(root, "statement_id"));
        return OperationHandle.statement(request.warehouseId(), statementId);
    }

    // ============================================================
    // fetchStatus / fetchPage
    // ============================================================

    @Override
    public StatusSnapshot fetchStatus(OperationHandle handle) {
        requireHandle(handle);
        String id = handle.getOperationId();
        switch (handle.getKind()) {
            case CONTEXT:
                return get(CONTEXTS_STATUS + query(Map.of("clusterId", handle.getResourceScope(), "contextId", id)),
                    root -> decoder.decodeContext(id, root));
            case COMMAND:
                return get(COMMANDS_STATUS + query(Map.of(
                        "clusterId", handle.getResourceScope(),
                        "contextId", handle.getParentId(),
                        "commandId", id)),
                    root -> decoder.decodeCommand(id, root));
            case STATEMENT:
                return get(STATEMENTS + "/" + encode(id), root -> decoder.decodeStatement(id, root));
            case RUN:
                return get(RUNS_GET + query(Map.of("run_id", id)), root -> decoder.decodeRun(id, root));
            default:
                throw new IllegalArgumentException("Unsupported handle kind: " + handle.getKind());
        }
    }

    @Override
    public ResultPage fetchPage(OperationHandle handle, String pageToken) {
        requireHandle(handle);
        if (handle.getKind() != OperationKind.STATEMENT) {
            throw new IllegalArgumentException("handle must be a statement handle (kind: " + handle.getKind() + ")");
        }
        if (pageToken == null || pageToken.isBlank()) {
            throw new IllegalArgumentException("pageToken cannot be null or blank");
        }
        return get(STATEMENTS + "/" + encode(handle.getOperationId()) + "/result/chunks/" + encode(pageToken),
            decoder::decodeChunk);
    }

    // ============================================================
    // cancel / dispose
    // ============================================================

    @Override
    public void cancel(OperationHandle handle) {
        requireHandle(handle);
        switch (handle.getKind()) {
            case COMMAND:
                post(COMMANDS_CANCEL, mapper.createObjectNode()
                    .put("clusterId", handle.getResourceScope())
                    .put("contextId", handle.getParentId())
                    .put("commandId", handle.getOperationId()), root -> null);
                break;
            case STATEMENT:
                post(STATEMENTS + "/" + encode(handle.getOperationId()) + "/cancel",
                    mapper.createObjectNode(), root -> null);
                break;
            case RUN:
                post(RUNS_CANCEL, runIdBody(handle.getOperationId()), root -> null);
                break;
            default:
                // 컨텍스트는 취소 대상이 아니며 destroy로만 정리
                log.debug("Cancel ignored for {}", handle);
                break;
        }
    }

    @Override
    public void dispose(OperationHandle handle) {
        requireHandle(handle);
        if (handle.getKind() != OperationKind.CONTEXT) {
            return;
        }
        post(CONTEXTS_DESTROY, mapper.createObjectNode()
            .put("clusterId", handle.getResourceScope())
            .put("contextId", handle.getOperationId()), root -> null);
    }

    // ============================================================
    // HTTP
    // ============================================================

    private <T> T get(String pathAndQuery, Function<JsonNode, T> decode) {
        HttpRequest request = baseRequest(pathAndQuery).GET().build();
        return send("GET " + pathOnly(pathAndQuery), request, decode);
    }

    private <T> T post(String path, ObjectNode body, Function<JsonNode, T> decode) {
        HttpRequest request = baseRequest(path)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
            .build();
        return send("POST " + path, request, decode);
    }

    private HttpRequest.Builder baseRequest(String pathAndQuery) {
        return HttpRequest.newBuilder()
            .uri(URI.create(config.host() + pathAndQuery))
            .timeout(Duration.ofMillis(config.requestTimeoutMs()))
            .header("Authorization", "Bearer " + config.token())
            .header("Accept", "application/json")
            .header("User-Agent", USER_AGENT);
    }

    private <T> T send(String operation, HttpRequest request, Function<JsonNode, T> decode) {
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.debug("{} failed: {}", operation, e.toString());
            throw classifier.fromIoFailure(operation, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw classifier.fromInterrupt(operation, e);
        }

        int status = response.statusCode();
        log.debug("{} -> {}", operation, status);
        if (status / 100 != 2) {
            throw classifier.fromResponse(operation, status, response.body());
        }
        return decode(operation, response.body(), decode);
    }

    private <T> T decode(String operation, String body, Function<JsonNode, T> decode) {
        try {
            JsonNode root = body == null || body.isBlank() ? mapper.createObjectNode() : mapper.readTree(body);
            return decode.apply(root);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw classifier.fromUndecodable(operation, body, e);
        }
    }

    private ObjectNode runIdBody(String runId) {
        ObjectNode body = mapper.createObjectNode();
        try {
            body.put("run_id", Long.parseLong(runId));
        } catch (NumberFormatException e) {
            body.put("run_id", runId);
        }
        return body;
    }

    private static String query(Map<String, String> parameters) {
        StringJoiner joiner = new StringJoiner("&", "?", "");
        parameters.entrySet().stream()
            .sorted(Map.Entry.comparingByKey())
            .forEach(entry -> joiner.add(encode(entry.getKey()) + "=" + encode(entry.getValue())));
        return joiner.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String pathOnly(String pathAndQuery) {
        int index = pathAndQuery.indexOf('?');
        return index < 0 ? pathAndQuery : pathAndQuery.substring(0, index);
    }

    private static void requireHandle(OperationHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
    }

    private static RestGatewayConfig requireConfig(RestGatewayConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }

    @Override
    public String toString() {
        return "RestOperationGateway{host=" + config.host() + "}";
    }
}
