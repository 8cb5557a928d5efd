package com.tenacy.perfpulse.domain;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 그룹 식별자. OVERALL 은 id 가 없다.
 *
 * <p>저장 시에는 유니크 인덱스가 동작하도록 OVERALL 의 id 컬럼에 0 을 쓴다.
 * 타입 컬럼이 함께 키에 들어가므로 실제 엔티티 id 0 과 충돌하지 않는다.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class GroupKey {

    private static final long OVERALL_STORAGE_ID = 0L;
    private static final GroupKey OVERALL = new GroupKey(GroupType.OVERALL, null);

    private final GroupType type;
    private final Long id;

    public static GroupKey overall() {
        return OVERALL;
    }

    public static GroupKey route(long routeId) {
        return new GroupKey(GroupType.ROUTE, routeId);
    }

    public static GroupKey query(long queryId) {
        return new GroupKey(GroupType.QUERY, queryId);
    }

    public static GroupKey of(GroupType type, Long id) {
        switch (type) {
            case OVERALL:
                return OVERALL;
            case ROUTE:
                return route(requireId(type, id));
            case QUERY:
                return query(requireId(type, id));
            default:
                throw new IllegalArgumentException("Unsupported group type: " + type);
        }
    }

    static GroupKey fromStorage(GroupType type, long storageId) {
        return type == GroupType.OVERALL ? OVERALL : of(type, storageId);
    }

    public long getStorageId() {
        return type == GroupType.OVERALL ? OVERALL_STORAGE_ID : id;
    }

    private static long requireId(GroupType type, Long id) {
        if (id == null) {
            throw new IllegalArgumentException(type + " group requires an id");
        }
        return id;
    }

    @Override
    public String toString() {
        return type == GroupType.OVERALL ? "overall" : type.name().toLowerCase() + "#" + id;
    }
}
