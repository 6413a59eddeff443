package com.ryuqq.remoteexec.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL 결과의 한 페이지 (chunk).
 *
 * <p>결과 집합은 클 수 있으므로 페이지 단위로 전달됩니다.
 * nextPageToken은 다음 페이지가 남아 있을 때만 존재합니다.</p>
 *
 * @param columns 컬럼 이름 (첫 페이지에만 채워질 수 있음)
 * @param rows 행 데이터 (각 값은 문자열, SQL NULL은 null)
 * @param chunkIndex 페이지 인덱스 (0부터 시작)
 * @param nextPageToken 다음 페이지 토큰 (마지막 페이지면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ResultPage(
    List<String> columns,
    List<List<String>> rows,
    int chunkIndex,
    String nextPageToken
) {

    public ResultPage {
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be non-negative (current: " + chunkIndex + ")");
        }
        columns = columns == null ? List.of() : List.copyOf(columns);
        // List.copyOf는 null 요소를 허용하지 않으므로 행은 불변 래핑만 함
        rows = rows == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(rows));
        if (nextPageToken != null && nextPageToken.isBlank()) {
            nextPageToken = null;
        }
    }

    /**
     * 빈 결과 페이지 (결과 행이 없는 문장용).
     *
     * @return 빈 페이지
     */
    public static ResultPage empty() {
        return new ResultPage(List.of(), List.of(), 0, null);
    }

    public boolean hasMore() {
        return nextPageToken != null;
    }

    public int rowCount() {
        return rows.size();
    }
}
