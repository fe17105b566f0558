/**
 * Progress sinks for tests.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.testkit.progress;
