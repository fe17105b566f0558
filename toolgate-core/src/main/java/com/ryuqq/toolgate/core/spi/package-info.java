/**
 * SPI (Service Provider Interface) 패키지.
 *
 * <p>ToolGate Core가 외부 구현에 기대하는 확장점을 정의합니다.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.toolgate.core.spi.Cache}: LRU + TTL 캐시</li>
 *   <li>{@link com.ryuqq.toolgate.core.spi.OperationRegistry}: 진행 중 Operation 추적 및 취소</li>
 *   <li>{@link com.ryuqq.toolgate.core.spi.Scheduler}: 취소 가능한 타이머</li>
 * </ul>
 *
 * <p>In-memory 구현은 {@code toolgate-adapter-inmemory} 모듈에 있습니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.core.spi;
