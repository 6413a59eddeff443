package com.ryuqq.remoteexec.core.request;

import com.ryuqq.remoteexec.core.model.OperationKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SQL Statement 실행 요청.
 *
 * <p>실행 컨텍스트 없이 웨어하우스에서 실행됩니다. warehouseId가 null이면
 * 엔진 설정의 기본 웨어하우스로 채워집니다 ({@link #withWarehouseId(String)}).</p>
 *
 * <p><strong>기본값:</strong> rowLimit=10000, byteLimit=100MB</p>
 *
 * @param statement SQL 문
 * @param warehouseId 웨어하우스 ID (null 가능)
 * @param catalog 카탈로그 (null 가능)
 * @param schema 스키마 (null 가능)
 * @param parameters 이름 있는 파라미터 (불변, 비어 있을 수 있음)
 * @param rowLimit 최대 행 수 (양수)
 * @param byteLimit 최대 바이트 수 (양수)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StatementRequest(
    String statement,
    String warehouseId,
    String catalog,
    String schema,
    Map<String, String> parameters,
    long rowLimit,
    long byteLimit
) implements SubmitRequest {

    public static final long DEFAULT_ROW_LIMIT = 10_000;
    public static final long DEFAULT_BYTE_LIMIT = 100_000_000;

    public StatementRequest {
        if (statement == null || statement.isBlank()) {
            throw new IllegalArgumentException("statement cannot be null or blank");
        }
        if (rowLimit <= 0) {
            throw new IllegalArgumentException("rowLimit must be positive (current: " + rowLimit + ")");
        }
        if (byteLimit <= 0) {
            throw new IllegalArgumentException("byteLimit must be positive (current: " + byteLimit + ")");
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    /**
     * 기본 제한값으로 요청 생성.
     *
     * @param statement SQL 문
     * @param warehouseId 웨어하우스 ID (null 가능)
     * @return StatementRequest
     */
    public static StatementRequest of(String statement, String warehouseId) {
        return new StatementRequest(statement, warehouseId, null, null, Map.of(), DEFAULT_ROW_LIMIT, DEFAULT_BYTE_LIMIT);
    }

    public StatementRequest withWarehouseId(String warehouseId) {
        return new StatementRequest(statement, warehouseId, catalog, schema, parameters, rowLimit, byteLimit);
    }

    public StatementRequest withCatalog(String catalog) {
        return new StatementRequest(statement, warehouseId, catalog, schema, parameters, rowLimit, byteLimit);
    }

    public StatementRequest withSchema(String schema) {
        return new StatementRequest(statement, warehouseId, catalog, schema, parameters, rowLimit, byteLimit);
    }

    /**
     * 파라미터 하나를 추가한 새 인스턴스 생성.
     */
    public StatementRequest withParameter(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(parameters);
        merged.put(name, value);
        return new StatementRequest(statement, warehouseId, catalog, schema, merged, rowLimit, byteLimit);
    }

    public StatementRequest withRowLimit(long rowLimit) {
        return new StatementRequest(statement, warehouseId, catalog, schema, parameters, rowLimit, byteLimit);
    }

    public StatementRequest withByteLimit(long byteLimit) {
        return new StatementRequest(statement, warehouseId, catalog, schema, parameters, rowLimit, byteLimit);
    }

    public boolean hasWarehouse() {
        return warehouseId != null && !warehouseId.isBlank();
    }

    @Override
    public OperationKind kind() {
        return OperationKind.STATEMENT;
    }
}
