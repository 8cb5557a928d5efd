package com.tenacy.perfpulse.sql;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

public class IdentifierProtectorTest {

    private final IdentifierProtector protector = new IdentifierProtector();

    @Test
    @DisplayName("백틱 식별자는 등장 순서대로 placeholder 로 바뀐다")
    void protectsBacktickIdentifiersInOrder() {
        // when
        ProtectedSql result = protector.protect("SELECT `name` FROM `users`");

        // then
        assertThat(result.getText()).isEqualTo("SELECT \u0000IDENTIFIER_0\u0000 FROM \u0000IDENTIFIER_1\u0000");
        assertThat(result.getIdentifiers()).containsExactly(
                entry("\u0000IDENTIFIER_0\u0000", "`name`"),
                entry("\u0000IDENTIFIER_1\u0000", "`users`"));
    }

    @Test
    @DisplayName("식별자처럼 보이는 큰따옴표만 보호하고 문장은 그대로 둔다")
    void protectsOnlyIdentifierLikeDoubleQuotes() {
        ProtectedSql result = protector.protect("SELECT \"users.id\" FROM t WHERE note = \"not an identifier\"");

        assertThat(result.getText()).isEqualTo("SELECT \u0000IDENTIFIER_0\u0000 FROM t WHERE note = \"not an identifier\"");
        assertThat(result.getIdentifiers()).hasSize(1);
    }

    @Test
    @DisplayName("복원 시 백틱 식별자는 큰따옴표 표기로 통일된다")
    void restoresWithCanonicalQuoting() {
        ProtectedSql result = protector.protect("SELECT `id`, \"name\" FROM `users`");

        assertThat(protector.restore(result)).isEqualTo("SELECT \"id\", \"name\" FROM \"users\"");
    }

    @Test
    @DisplayName("식별자 판별: 단순 이름이나 점 표기는 식별자로 본다")
    void detectsIdentifierLikeContent() {
        assertThat(IdentifierProtector.looksLikeIdentifier("user_id")).isTrue();
        assertThat(IdentifierProtector.looksLikeIdentifier("users.id")).isTrue();
        assertThat(IdentifierProtector.looksLikeIdentifier("hello world")).isFalse();
        assertThat(IdentifierProtector.looksLikeIdentifier("2fast")).isFalse();
    }

    @Test
    @DisplayName("placeholder 와 같은 모양의 원문 텍스트는 복원 시 건드리지 않는다")
    void leavesPlaceholderLookalikeTextIntact() {
        ProtectedSql result = protector.protect("SELECT * FROM t WHERE a = __IDENTIFIER_0__ AND b = `c`");

        assertThat(protector.restore(result)).isEqualTo("SELECT * FROM t WHERE a = __IDENTIFIER_0__ AND b = \"c\"");
    }

    @Test
    @DisplayName("입력에 섞인 NUL 문자는 보호 전에 제거된다")
    void stripsNulCharactersBeforeProtecting() {
        ProtectedSql result = protector.protect("SELECT `a`\u0000IDENTIFIER_0\u0000 FROM t");

        assertThat(protector.restore(result)).isEqualTo("SELECT \"a\"IDENTIFIER_0 FROM t");
    }
}
