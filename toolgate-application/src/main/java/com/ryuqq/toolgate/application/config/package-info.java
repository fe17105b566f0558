/**
 * 환경 변수 기반 설정.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.application.config;
