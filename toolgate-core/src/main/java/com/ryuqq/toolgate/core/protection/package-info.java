/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>외부 도구 호출이 원격 API에 도달하기 전에 거치는 보호 메커니즘의 확장점을 제공합니다.</p>
 *
 * <h2>보호 체인 순서</h2>
 *
 * <pre>
 * 1. OperationRegistry → 취소 컨텍스트 생성
 * 2. RateLimiter       → 토큰 대기 (취소 가능)
 * 3. RetryExecutor     → 원격 호출, 재시도마다 다시 RateLimiter 통과
 * 4. ProgressReporter  → 진행률 전달
 * 5. OperationRegistry → 모든 종료 경로에서 completeOperation
 * </pre>
 *
 * <p>Cache는 체인 옆에 위치하며, 호출부가 동일 요청을 RateLimiter/Retry 경로 진입 전에 중복 제거하는 데 사용합니다.</p>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.toolgate.core.protection.noop.NoOpRateLimiter}는
 * 모든 요청을 즉시 허용합니다. 개발/테스트 환경에서 보호 없이 빠르게 실행할 때 사용합니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 * @see com.ryuqq.toolgate.core.protection.RateLimiter
 * @see com.ryuqq.toolgate.core.protection.noop
 */
package com.ryuqq.toolgate.core.protection;
