package com.tenacy.perfpulse.sql;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 숫자, 문자열, 불리언 리터럴을 {@code ?} 로 치환한다. 적용 순서가 바뀌면 이중 치환이 생기므로 순서를 유지할 것.
 */
public class LiteralReplacer {

    public static final String PLACEHOLDER = "?";

    private static final List<Pattern> LITERAL_PATTERNS = List.of(
            // 실수를 정수보다 먼저 처리
            Pattern.compile("(?<![a-zA-Z_])\\b\\d+\\.\\d+\\b(?![a-zA-Z_])"),
            // users2, user_id2 같은 식별자 안의 숫자는 건드리지 않는다
            Pattern.compile("(?<![a-zA-Z_])\\b\\d+\\b(?![a-zA-Z_])"),
            // 작은따옴표 문자열 ('' 이스케이프 지원)
            Pattern.compile("'[^']*(?:''[^']*)*'"),
            // 보호되지 않은 큰따옴표 문자열
            Pattern.compile("\"[^\"]*(?:\"\"[^\"]*)*\""),
            Pattern.compile("\\b(true|false)\\b", Pattern.CASE_INSENSITIVE)
    );

    public String replace(String sql) {
        String normalized = sql;
        for (Pattern pattern : LITERAL_PATTERNS) {
            normalized = pattern.matcher(normalized).replaceAll(PLACEHOLDER);
        }
        return normalized;
    }
}
