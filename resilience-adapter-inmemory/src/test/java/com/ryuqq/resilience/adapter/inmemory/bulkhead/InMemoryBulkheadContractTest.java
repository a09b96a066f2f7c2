package com.ryuqq.resilience.adapter.inmemory.bulkhead;

import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.testkit.contract.BulkheadContract;

/**
 * Runs the {@link BulkheadContract} against {@link InMemoryBulkhead}.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class InMemoryBulkheadContractTest extends BulkheadContract {

    @Override
    protected Bulkhead createBulkhead(BulkheadConfig config) {
        return new InMemoryBulkhead(resourceId, config);
    }
}
