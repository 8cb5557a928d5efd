package com.tenacy.perfpulse.sql;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * SQL 문자열에서 리터럴 값만 placeholder 로 바꾸고 테이블/컬럼 이름은 보존해 쿼리 형태(fingerprint)를 만든다.
 *
 * <p>처리 순서: 식별자 보호 -> 리터럴 치환 -> 가변 구문 정규화 -> 식별자 복원 -> 공백 정리.
 * 입출력 외 부수효과가 없는 순수 함수이며, 이미 정규화된 문자열에 다시 적용해도 결과가 같다.
 */
@Component
public class SqlQueryNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final IdentifierProtector identifierProtector = new IdentifierProtector();
    private final LiteralReplacer literalReplacer = new LiteralReplacer();
    private final ConstructNormalizer constructNormalizer = new ConstructNormalizer();

    public String normalize(String sql) {
        if (sql == null) {
            return null;
        }
        if (sql.isEmpty()) {
            return "";
        }

        ProtectedSql protectedSql = identifierProtector.protect(sql);

        String text = literalReplacer.replace(protectedSql.getText());
        text = constructNormalizer.normalize(text);

        text = identifierProtector.restore(protectedSql.withText(text));

        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
