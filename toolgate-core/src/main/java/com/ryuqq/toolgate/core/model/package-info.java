/**
 * 도메인 식별자 패키지.
 *
 * <p>도구 호출을 식별하는 {@link com.ryuqq.toolgate.core.model.OpId}를 제공합니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.core.model;
