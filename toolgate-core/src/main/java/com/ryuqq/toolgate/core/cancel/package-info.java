/**
 * 취소 전파 패키지.
 *
 * <p>{@link com.ryuqq.toolgate.core.cancel.CancellationSource}가 신호를 보내고
 * {@link com.ryuqq.toolgate.core.cancel.CancellationToken}이 신호를 받습니다.
 * 바깥 취소 한 번이 안쪽 모든 대기 지점에 도달하도록 토큰은 항상 명시적으로 전달합니다.</p>
 *
 * <h2>대기 지점 계약</h2>
 * <ul>
 *   <li>이미 취소된 토큰: 자원(토큰, 재시도 슬롯) 소비 전에 즉시 실패</li>
 *   <li>대기 중 취소: 예약된 타이머를 해제하고 OperationCancelledException으로 실패</li>
 *   <li>정상 완료: 취소 콜백 등록 해제</li>
 * </ul>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.core.cancel;
