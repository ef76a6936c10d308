package com.ryuqq.conduit.core.model;

/**
 * 논리 Operation의 이름.
 *
 * <p>로그 상관관계 및 Priority Lane 허용 목록(allow-list) 검사에 사용됩니다.
 * 비즈니스 의미는 갖지 않으며, 호출 지점을 식별하는 라벨입니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.), 콜론(:), 슬래시(/)만 허용</li>
 * </ul>
 *
 * @author Conduit Team
 * @since 1.0.0
 */
public final class OperationName {

    private static final int MAX_LENGTH = 128;

    /**
     * 이름이 지정되지 않은 호출에 사용되는 기본값.
     */
    public static final OperationName ANONYMOUS = new OperationName("anonymous");

    private final String value;

    private OperationName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OperationName cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("OperationName length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.:/]+$")) {
            throw new IllegalArgumentException(
                "OperationName contains invalid characters (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * OperationName 생성.
     *
     * @param value 이름
     * @return OperationName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OperationName of(String value) {
        return new OperationName(value);
    }

    /**
     * 이름 값 조회.
     *
     * @return 이름 문자열
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OperationName that = (OperationName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
