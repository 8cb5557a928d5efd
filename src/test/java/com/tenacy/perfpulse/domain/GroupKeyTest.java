package com.tenacy.perfpulse.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GroupKeyTest {

    @Test
    @DisplayName("전체 그룹은 id 가 없고 저장 시 0 으로 기록된다")
    void overallKeyShouldUseZeroStorageId() {
        GroupKey overall = GroupKey.overall();

        assertThat(overall.getId()).isNull();
        assertThat(overall.getStorageId()).isZero();
        assertThat(GroupKey.fromStorage(GroupType.OVERALL, 0L)).isSameAs(overall);
        assertThat(GroupKey.of(GroupType.OVERALL, 42L)).isSameAs(overall);
    }

    @Test
    @DisplayName("라우트/쿼리 그룹은 타입과 id 로 구분된다")
    void entityKeysShouldCompareByTypeAndId() {
        assertThat(GroupKey.route(7L)).isEqualTo(GroupKey.of(GroupType.ROUTE, 7L));
        assertThat(GroupKey.route(7L)).isNotEqualTo(GroupKey.query(7L));
        assertThat(GroupKey.fromStorage(GroupType.QUERY, 3L).getId()).isEqualTo(3L);
        assertThat(GroupKey.route(7L).toString()).isEqualTo("route#7");
    }

    @Test
    @DisplayName("라우트/쿼리 그룹에 id 가 없으면 예외")
    void entityKeyWithoutIdShouldBeRejected() {
        assertThatThrownBy(() -> GroupKey.of(GroupType.QUERY, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("QUERY");
    }
}
