/**
 * 도구 호출 계약 패키지.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.core.contract;
