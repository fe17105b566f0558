package com.ryuqq.toolgate.adapter.inmemory.registry;

import com.ryuqq.toolgate.core.spi.OperationRegistry;
import com.ryuqq.toolgate.testkit.contract.AbstractOperationRegistryContractTest;

/**
 * Runs the operation registry contract against {@link InMemoryOperationRegistry}.
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
class InMemoryOperationRegistryContractTest extends AbstractOperationRegistryContractTest {

    @Override
    protected OperationRegistry createRegistry() {
        return new InMemoryOperationRegistry();
    }
}
