package com.ryuqq.toolgate.core.model;

/**
 * 진행 중인 도구 호출(Operation)의 식별자.
 *
 * <p>OpId는 취소 컨텍스트 조회와 진행률 알림 태깅에 사용됩니다.
 * 클라이언트가 전달한 progress token 또는 UUID가 그대로 값이 되므로
 * 형식은 불투명(opaque)하게 취급합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public final class OpId {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private OpId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("OpId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("OpId length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * OpId 생성.
     *
     * @param value OpId 값
     * @return OpId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static OpId of(String value) {
        return new OpId(value);
    }

    /**
     * 무작위 UUID 기반 OpId 생성.
     *
     * <p>클라이언트가 progress token을 주지 않은 호출에 사용합니다.</p>
     *
     * @return 새 OpId
     */
    public static OpId random() {
        return new OpId(java.util.UUID.randomUUID().toString());
    }

    /**
     * OpId 값 조회.
     *
     * @return OpId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OpId opId = (OpId) o;
        return value.equals(opId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "OpId{" + value + '}';
    }
}
