/**
 * In-memory operation registry.
 *
 * @see com.ryuqq.toolgate.core.spi.OperationRegistry
 * @author ToolGate Team
 * @since 1.0.0
 */
package com.ryuqq.toolgate.adapter.inmemory.registry;
