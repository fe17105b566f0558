package com.ryuqq.toolgate.adapter.inmemory.registry;

import com.ryuqq.toolgate.core.cancel.CancellationSource;
import com.ryuqq.toolgate.core.cancel.CancellationToken;
import com.ryuqq.toolgate.core.model.OpId;
import com.ryuqq.toolgate.core.spi.OperationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link OperationRegistry}.
 *
 * <p>Each registered operation owns one {@link CancellationSource}. The registry is the only holder
 * of the source; callers see the read-only {@link CancellationToken}.</p>
 *
 * <p><strong>Duplicate IDs:</strong> registering an id that is already active replaces the record
 * and logs a warning. The replaced source is not cancelled; the earlier caller keeps running
 * but can no longer be cancelled through the registry.</p>
 *
 * <p><strong>Thread Safety:</strong> backed by {@link ConcurrentHashMap}; no manual locking.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * OperationRegistry registry = new InMemoryOperationRegistry();
 *
 * CancellationToken token = registry.createCancellableOperation(opId);
 * try {
 *     ...
 * } finally {
 *     registry.completeOperation(opId);
 * }
 * </pre>
 *
 * @author ToolGate Team
 * @since 1.0.0
 */
public class InMemoryOperationRegistry implements OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOperationRegistry.class);

    /**
     * OpId → cancellation source of the active operation.
     */
    private final ConcurrentHashMap<OpId, CancellationSource> operations = new ConcurrentHashMap<>();

    @Override
    public CancellationToken createCancellableOperation(OpId opId) {
        if (opId == null) {
            throw new IllegalArgumentException("opId cannot be null");
        }
        CancellationSource source = new CancellationSource();
        CancellationSource previous = operations.put(opId, source);
        if (previous != null) {
            log.warn("Operation {} was already active; replacing its cancellation context", opId.getValue());
        }
        return source.token();
    }

    /**
     * {@inheritDoc}
     *
     * <p>The record is removed before the token fires, so cancel callbacks observe the operation
     * as inactive.</p>
     */
    @Override
    public boolean cancelOperation(OpId opId) {
        if (opId == null) {
            return false;
        }
        CancellationSource source = operations.remove(opId);
        if (source == null) {
            return false;
        }
        log.debug("Cancelling operation {}", opId.getValue());
        source.cancel();
        return true;
    }

    @Override
    public void completeOperation(OpId opId) {
        if (opId != null) {
            operations.remove(opId);
        }
    }

    @Override
    public boolean isActive(OpId opId) {
        return opId != null && operations.containsKey(opId);
    }

    @Override
    public int getActiveOperationCount() {
        return operations.size();
    }
}
