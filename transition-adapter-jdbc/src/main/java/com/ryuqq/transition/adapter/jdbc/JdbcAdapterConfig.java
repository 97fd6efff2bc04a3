package com.ryuqq.transition.adapter.jdbc;

import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * JDBC adapter 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>auditTable: 감사 로그 테이블 이름 (기본 "state_machine_log")</li>
 *   <li>idColumn: 엔티티 테이블의 PK 컬럼 이름 (기본 "id")</li>
 *   <li>tableNameResolver: 엔티티 타입 이름 → 테이블 이름 (기본 snake_case, 예: "OrderLine" → "order_line")</li>
 * </ul>
 *
 * <p>SQL에 그대로 들어가는 이름이므로 모두 식별자 형식이어야 합니다
 * (영문자 또는 언더스코어로 시작, 스키마 한정 이름 허용).</p>
 *
 * @author Transition Team
 * @since 1.0.0
 * @param auditTable 감사 로그 테이블 이름
 * @param idColumn 엔티티 PK 컬럼 이름
 * @param tableNameResolver 타입 이름에서 테이블 이름을 구하는 함수
 */
public record JdbcAdapterConfig(
    String auditTable,
    String idColumn,
    Function<String, String> tableNameResolver
) {

    public static final String DEFAULT_AUDIT_TABLE = "state_machine_log";
    public static final String DEFAULT_ID_COLUMN = "id";

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: auditTable="state_machine_log", idColumn="id", tableNameResolver=snake_case</p>
     */
    public JdbcAdapterConfig() {
        this(DEFAULT_AUDIT_TABLE, DEFAULT_ID_COLUMN, JdbcAdapterConfig::snakeCase);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public JdbcAdapterConfig {
        requireIdentifier(auditTable, "auditTable");
        requireIdentifier(idColumn, "idColumn");
        if (tableNameResolver == null) {
            throw new IllegalArgumentException("tableNameResolver cannot be null");
        }
    }

    /**
     * 엔티티 타입의 테이블 이름.
     *
     * @param typeName 엔티티 타입 이름
     * @return 검증된 테이블 이름
     * @throws IllegalArgumentException resolver 결과가 식별자가 아닌 경우
     */
    public String tableFor(String typeName) {
        String table = tableNameResolver.apply(typeName);
        requireIdentifier(table, "table for type " + typeName);
        return table;
    }

    public JdbcAdapterConfig withAuditTable(String auditTable) {
        return new JdbcAdapterConfig(auditTable, idColumn, tableNameResolver);
    }

    public JdbcAdapterConfig withIdColumn(String idColumn) {
        return new JdbcAdapterConfig(auditTable, idColumn, tableNameResolver);
    }

    public JdbcAdapterConfig withTableNameResolver(Function<String, String> tableNameResolver) {
        return new JdbcAdapterConfig(auditTable, idColumn, tableNameResolver);
    }

    /**
     * CamelCase 이름을 snake_case로 변환.
     *
     * @param typeName 타입 이름
     * @return snake_case 이름 (예: "OrderLine" → "order_line")
     */
    public static String snakeCase(String typeName) {
        if (typeName == null) {
            return null;
        }
        StringBuilder result = new StringBuilder(typeName.length() + 4);
        for (int i = 0; i < typeName.length(); i++) {
            char c = typeName.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0 && !Character.isUpperCase(typeName.charAt(i - 1))) {
                    result.append('_');
                }
                result.append(Character.toLowerCase(c));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }

    static void requireIdentifier(String value, String field) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException(field + " must be an SQL identifier (current: " + value + ")");
        }
    }
}
