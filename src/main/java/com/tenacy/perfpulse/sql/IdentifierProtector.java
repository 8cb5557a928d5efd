package com.tenacy.perfpulse.sql;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 따옴표로 감싼 식별자를 placeholder 로 치환해 리터럴 치환 단계에서 깨지지 않게 보호한다.
 */
public class IdentifierProtector {

    private static final Pattern BACKTICK_IDENTIFIER = Pattern.compile("`([^`]+)`");
    private static final Pattern DOUBLE_QUOTED = Pattern.compile("\"([^\"]+)\"");
    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

    // NUL 은 SQL 본문에 나올 수 없으므로 원문과 placeholder 가 겹치지 않는다
    private static final char PLACEHOLDER_DELIMITER = '\u0000';
    private static final String PLACEHOLDER_FORMAT = PLACEHOLDER_DELIMITER + "IDENTIFIER_%d" + PLACEHOLDER_DELIMITER;

    public ProtectedSql protect(String sql) {
        Map<String, String> identifiers = new LinkedHashMap<>();

        String text = sql.replace(String.valueOf(PLACEHOLDER_DELIMITER), "");

        // MySQL 스타일 백틱 식별자
        text = replaceAll(BACKTICK_IDENTIFIER.matcher(text), identifiers, true);

        // 표준 SQL 큰따옴표 식별자 (문장처럼 보이면 문자열 리터럴로 남겨둔다)
        text = replaceAll(DOUBLE_QUOTED.matcher(text), identifiers, false);

        return new ProtectedSql(text, identifiers);
    }

    /**
     * placeholder 를 원래 식별자로 되돌린다. 백틱/큰따옴표 표기 차이는 큰따옴표로 통일한다.
     */
    public String restore(ProtectedSql protectedSql) {
        String text = protectedSql.getText();
        for (Map.Entry<String, String> entry : protectedSql.getIdentifiers().entrySet()) {
            text = text.replace(entry.getKey(), canonicalSpelling(entry.getValue()));
        }
        return text;
    }

    static boolean looksLikeIdentifier(String content) {
        return SIMPLE_IDENTIFIER.matcher(content).matches() || content.contains(".");
    }

    private String replaceAll(Matcher matcher, Map<String, String> identifiers, boolean always) {
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String content = matcher.group(1);
            if (always || looksLikeIdentifier(content)) {
                String placeholder = String.format(PLACEHOLDER_FORMAT, identifiers.size());
                identifiers.put(placeholder, matcher.group());
                matcher.appendReplacement(sb, Matcher.quoteReplacement(placeholder));
            } else {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group()));
            }
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private String canonicalSpelling(String quoted) {
        String content = quoted.substring(1, quoted.length() - 1);
        // 큰따옴표로 바꿔도 다시 식별자로 인식되는 경우에만 통일 (멱등성 유지)
        if (quoted.charAt(0) == '`' && looksLikeIdentifier(content)) {
            return "\"" + content + "\"";
        }
        return quoted;
    }
}
