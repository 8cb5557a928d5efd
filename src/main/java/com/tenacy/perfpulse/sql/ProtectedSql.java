package com.tenacy.perfpulse.sql;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 식별자 보호 단계의 결과. 치환된 SQL 과 placeholder -> 원래 식별자 매핑을 함께 들고 다닌다.
 */
@Value
public class ProtectedSql {

    String text;
    Map<String, String> identifiers;

    public ProtectedSql(String text, Map<String, String> identifiers) {
        this.text = text;
        this.identifiers = Collections.unmodifiableMap(new LinkedHashMap<>(identifiers));
    }

    public ProtectedSql withText(String newText) {
        return new ProtectedSql(newText, identifiers);
    }
}
