package com.tenacy.perfpulse.sql;

import java.util.Collections;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 값 개수가 가변적인 구문을 정규화한다. IN 목록은 값 개수만큼의 placeholder 로 바꾼다.
 */
public class ConstructNormalizer {

    private static final Pattern IN_LIST = Pattern.compile("\\bIN\\s*\\(\\s*([^)]+)\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUBQUERY_START = Pattern.compile("^(SELECT|WITH)\\b", Pattern.CASE_INSENSITIVE);

    public String normalize(String sql) {
        Matcher matcher = IN_LIST.matcher(sql);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String content = matcher.group(1).trim();
            if (SUBQUERY_START.matcher(content).find()) {
                // 서브쿼리는 테이블/컬럼 정보를 잃지 않도록 그대로 둔다
                matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            int valueCount = content.split(",").length;
            String placeholders = String.join(", ", Collections.nCopies(valueCount, LiteralReplacer.PLACEHOLDER));
            matcher.appendReplacement(sb, Matcher.quoteReplacement("IN (" + placeholders + ")"));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
