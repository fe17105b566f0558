/**
 * Abstract contract tests for ToolGate SPI implementations.
 *
 * <p>Adapters extend these classes and supply a factory method; every scenario then runs against
 * the adapter under a manual clock and scheduler.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.testkit.contract;
