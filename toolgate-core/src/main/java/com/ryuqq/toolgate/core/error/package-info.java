/**
 * 오류 분류 패키지.
 *
 * <h2>분류</h2>
 * <ul>
 *   <li>{@link com.ryuqq.toolgate.core.error.RateLimitExceededException}: 토큰 없음, retryAfterMs 포함</li>
 *   <li>{@link com.ryuqq.toolgate.core.error.OperationCancelledException}: 대기 중 취소</li>
 *   <li>재시도 소진: 별도 타입 없음, 마지막 원본 오류를 그대로 전파</li>
 *   <li>설정 오류: 생성 시점 {@link java.lang.IllegalArgumentException}</li>
 * </ul>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.core.error;
