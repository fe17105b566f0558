/**
 * Manual clock and scheduler for deterministic timing tests.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.testkit.time;
