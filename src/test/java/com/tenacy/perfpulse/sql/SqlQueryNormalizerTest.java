package com.tenacy.perfpulse.sql;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

public class SqlQueryNormalizerTest {

    private final SqlQueryNormalizer normalizer = new SqlQueryNormalizer();

    @Test
    @DisplayName("숫자와 문자열 리터럴만 치환되고 테이블/컬럼 이름은 유지된다")
    void replacesLiteralsAndKeepsIdentifiers() {
        // given
        String sql = "SELECT users.* FROM users WHERE users.id = 123 AND users.email = 'a@b.com'";

        // when
        String normalized = normalizer.normalize(sql);

        // then
        assertThat(normalized).isEqualTo("SELECT users.* FROM users WHERE users.id = ? AND users.email = ?");
    }

    @Test
    @DisplayName("리터럴 값만 다른 쿼리는 같은 형태로 정규화된다")
    void collapsesQueriesDifferingOnlyInLiterals() {
        String first = normalizer.normalize(
                "SELECT * FROM orders WHERE total > 10.5 AND status = 'paid' AND archived = false");
        String second = normalizer.normalize(
                "SELECT * FROM orders WHERE total > 999.99 AND status = 'refunded' AND archived = TRUE");

        assertThat(first).isEqualTo(second);
        assertThat(first).isEqualTo("SELECT * FROM orders WHERE total > ? AND status = ? AND archived = ?");
    }

    @Test
    @DisplayName("placeholder 와 같은 이름의 컬럼이 있어도 다른 식별자로 바뀌지 않는다")
    void keepsColumnsNamedLikeInternalPlaceholders() {
        String normalized = normalizer.normalize("SELECT * FROM t WHERE __IDENTIFIER_0__ = 1 AND `c` = 2");

        assertThat(normalized).isEqualTo("SELECT * FROM t WHERE __IDENTIFIER_0__ = ? AND \"c\" = ?");
    }

    @Test
    @DisplayName("백틱과 큰따옴표 식별자 표기 차이는 같은 형태로 정규화된다")
    void collapsesIdentifierQuotingStyles() {
        String mysql = normalizer.normalize("SELECT * FROM `users` WHERE `users`.`id` = 5");
        String ansi = normalizer.normalize("SELECT * FROM \"users\" WHERE \"users\".\"id\" = 42");

        assertThat(mysql).isEqualTo(ansi);
        assertThat(mysql).isEqualTo("SELECT * FROM \"users\" WHERE \"users\".\"id\" = ?");
    }

    @Test
    @DisplayName("다른 테이블이나 컬럼을 참조하면 다른 형태가 된다")
    void keepsDifferentTablesDistinct() {
        assertThat(normalizer.normalize("SELECT * FROM users WHERE id = 1"))
                .isNotEqualTo(normalizer.normalize("SELECT * FROM orders WHERE id = 1"));
        assertThat(normalizer.normalize("SELECT * FROM users WHERE id = 1"))
                .isNotEqualTo(normalizer.normalize("SELECT * FROM users WHERE account_id = 1"));
    }

    @Test
    @DisplayName("식별자 안의 숫자는 리터럴로 취급하지 않는다")
    void leavesDigitsInsideIdentifiers() {
        String normalized = normalizer.normalize("SELECT users2.user_id2 FROM users2 WHERE users2.user_id2 = 7");

        assertThat(normalized).isEqualTo("SELECT users2.user_id2 FROM users2 WHERE users2.user_id2 = ?");
    }

    @Test
    @DisplayName("IN 목록은 값 개수를 유지한 채 placeholder 로 바뀐다")
    void canonicalizesInListsByArity() {
        String three = normalizer.normalize("SELECT * FROM users WHERE id IN (1,2,3)");
        String otherThree = normalizer.normalize("SELECT * FROM users WHERE id IN (4, 5, 6)");
        String one = normalizer.normalize("SELECT * FROM users WHERE id IN (1)");
        String two = normalizer.normalize("SELECT * FROM users WHERE id IN (1,2)");

        assertThat(three).isEqualTo(otherThree);
        assertThat(three).isEqualTo("SELECT * FROM users WHERE id IN (?, ?, ?)");
        assertThat(one).isEqualTo("SELECT * FROM users WHERE id IN (?)");
        assertThat(one).isNotEqualTo(two);
    }

    @Test
    @DisplayName("IN 서브쿼리는 참조 테이블 정보를 잃지 않는다")
    void keepsSubqueryInsideIn() {
        String orders = normalizer.normalize(
                "SELECT * FROM users WHERE id IN (SELECT user_id FROM orders WHERE total > 100)");
        String payments = normalizer.normalize(
                "SELECT * FROM users WHERE id IN (SELECT user_id FROM payments WHERE total > 100)");

        assertThat(orders).isEqualTo("SELECT * FROM users WHERE id IN (SELECT user_id FROM orders WHERE total > ?)");
        assertThat(orders).isNotEqualTo(payments);
    }

    @Test
    @DisplayName("BETWEEN 은 두 개의 placeholder 로 남는다")
    void leavesBetweenWithTwoPlaceholders() {
        String normalized = normalizer.normalize(
                "SELECT * FROM events WHERE created_at BETWEEN '2024-01-01' AND '2024-02-01'");

        assertThat(normalized).isEqualTo("SELECT * FROM events WHERE created_at BETWEEN ? AND ?");
    }

    @Test
    @DisplayName("작은따옴표 이스케이프와 문장형 큰따옴표 문자열도 리터럴로 치환된다")
    void replacesEscapedAndProseStrings() {
        assertThat(normalizer.normalize("SELECT * FROM people WHERE name = 'O''Brien'"))
                .isEqualTo("SELECT * FROM people WHERE name = ?");
        assertThat(normalizer.normalize("SELECT * FROM notes WHERE body = \"hello world\""))
                .isEqualTo("SELECT * FROM notes WHERE body = ?");
    }

    @Test
    @DisplayName("연속 공백은 하나로 줄이고 앞뒤 공백은 제거한다")
    void collapsesWhitespace() {
        assertThat(normalizer.normalize("  SELECT *\n   FROM users\tWHERE id = 1  "))
                .isEqualTo("SELECT * FROM users WHERE id = ?");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT users.* FROM users WHERE users.id = 123 AND users.email = 'a@b.com'",
            "SELECT * FROM `users` WHERE `users`.`id` IN (1, 2, 3)",
            "SELECT * FROM \"orders\" WHERE note = \"free text here\" AND paid = true",
            "UPDATE accounts SET balance = 10.25 WHERE id = 9",
            "SELECT * FROM users WHERE id IN (SELECT user_id FROM orders WHERE total > 100)"
    })
    @DisplayName("정규화 결과에 다시 적용해도 결과가 같다")
    void isIdempotent(String sql) {
        String once = normalizer.normalize(sql);

        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("null 은 null, 빈 문자열은 빈 문자열을 돌려준다")
    void handlesNullAndEmpty() {
        assertThat(normalizer.normalize(null)).isNull();
        assertThat(normalizer.normalize("")).isEmpty();
    }
}
