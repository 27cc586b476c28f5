package com.brokerbridge.engine.id;

import com.brokerbridge.engine.transport.CommandGateway;

import java.time.Duration;

/**
 * Source of order ids for one session. Allocations are serialized.
 */
public interface OrderIdAllocator {

    /**
     * @return an order id never handed out before by this session
     * @throws com.brokerbridge.engine.error.AllocationTimeoutException if the broker does not supply an id in time
     */
    int nextId();

    OrderIdStrategy getStrategy();

    static OrderIdAllocator create(String sessionName, OrderIdStrategy strategy, NextValidIdQueue queue,
                                   RequestIdSequence sequence, CommandGateway gateway,
                                   int maxAttempts, Duration attemptTimeout) {
        return switch (strategy) {
            case RETRY -> new UpstreamOrderIdAllocator(sessionName, strategy, queue, sequence, gateway,
                    maxAttempts, attemptTimeout);
            case BASIC -> new UpstreamOrderIdAllocator(sessionName, strategy, queue, sequence, gateway,
                    1, attemptTimeout);
            case INCREMENT -> new IncrementingOrderIdAllocator(sessionName, queue, sequence, attemptTimeout);
        };
    }
}
