package com.ryuqq.toolgate.core.progress;

/**
 * 진행률 알림 페이로드.
 *
 * <p>progressToken에는 Operation ID 값이 들어가며, 클라이언트는 이 값으로
 * 어느 호출의 진행률인지 구분합니다.</p>
 *
 * @param progressToken 진행률 토큰 (Operation ID 값)
 * @param progress 현재 진행량
 * @param total 전체량
 * @param message 사람이 읽을 수 있는 메시지 (null 가능)
 * @author ToolGate Team
 * @since 1.0.0
 */
public record ProgressNotification(
    String progressToken,
    double progress,
    double total,
    String message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException progressToken이 null이거나 빈 문자열인 경우
     */
    public ProgressNotification {
        if (progressToken == null || progressToken.isBlank()) {
            throw new IllegalArgumentException("progressToken cannot be null or blank");
        }
    }
}
