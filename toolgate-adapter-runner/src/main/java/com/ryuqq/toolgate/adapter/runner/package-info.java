/**
 * ToolGate Runner - 디스패처와 재시도 실행기 구현.
 *
 * <h2>주요 컴포넌트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.toolgate.adapter.runner.GuardedToolDispatcher} - 등록, Rate Limit, 재시도, 완료 처리를 묶는 디스패처</li>
 *   <li>{@link com.ryuqq.toolgate.adapter.runner.RetryExecutor} - Exponential Backoff 재시도</li>
 *   <li>{@link com.ryuqq.toolgate.adapter.runner.BackoffCalculator} - 재시도 대기 계산</li>
 *   <li>{@link com.ryuqq.toolgate.adapter.runner.CancellableSleep} - 취소 가능한 대기</li>
 *   <li>{@link com.ryuqq.toolgate.adapter.runner.ExecutorScheduler} - ScheduledExecutorService 기반 타이머</li>
 *   <li>{@link com.ryuqq.toolgate.adapter.runner.RateLimitedCalls} - 호출 단위 Rate Limit 래퍼</li>
 *   <li>{@link com.ryuqq.toolgate.adapter.runner.ToolGateDefaults} - 기본 인스턴스 보관소</li>
 * </ul>
 *
 * <h2>취소 전파</h2>
 * <p>Operation 토큰 하나가 Rate Limit 대기, 재시도 판단, 재시도 간 sleep까지 그대로 전달됩니다.
 * 취소된 대기는 타이머를 해제하고 토큰을 소비하지 않습니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.adapter.runner;
