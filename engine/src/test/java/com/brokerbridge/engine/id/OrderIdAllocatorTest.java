package com.brokerbridge.engine.id;

import com.brokerbridge.config.ClockProvider;
import com.brokerbridge.engine.error.AllocationTimeoutException;
import com.brokerbridge.engine.event.BrokerEvent;
import com.brokerbridge.engine.event.NextValidIdEvent;
import com.brokerbridge.engine.support.ScriptedTransport;
import com.brokerbridge.engine.transport.CommandGateway;
import com.brokerbridge.engine.transport.CommandType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OrderIdAllocatorTest {

    private static final Duration ATTEMPT_TIMEOUT = Duration.ofMillis(100);

    private ScriptedTransport transport;
    private NextValidIdQueue queue;
    private RequestIdSequence sequence;
    private CommandGateway gateway;

    @BeforeEach
    void setUp() throws Exception {
        transport = new ScriptedTransport();
        queue = new NextValidIdQueue("test");
        sequence = new RequestIdSequence();
        transport.connect("localhost", 7497, 0, event -> {
            if (event instanceof NextValidIdEvent) {
                queue.onNextValidId(((NextValidIdEvent) event).orderId());
            }
        });
        gateway = new CommandGateway("test", transport, ClockProvider.system(), 0);
    }

    private OrderIdAllocator allocator(OrderIdStrategy strategy, int maxAttempts) {
        return OrderIdAllocator.create("test", strategy, queue, sequence, gateway, maxAttempts, ATTEMPT_TIMEOUT);
    }

    // ==================== INCREMENT ====================

    @Test
    void incrementStartsAtTheSeedAndCountsUpLocally() {
        transport.deliver(new NextValidIdEvent(100));
        OrderIdAllocator allocator = allocator(OrderIdStrategy.INCREMENT, 1);

        assertEquals(100, allocator.nextId());
        assertEquals(101, allocator.nextId());
        assertEquals(102, allocator.nextId());
        assertTrue(transport.commands(CommandType.REQUEST_IDS).isEmpty());
    }

    @Test
    void incrementIdsStayStrictlyIncreasingWhenInterleavedWithRequestIds() {
        transport.deliver(new NextValidIdEvent(1));
        OrderIdAllocator allocator = allocator(OrderIdStrategy.INCREMENT, 1);

        int previous = 0;
        for (int i = 0; i < 200; i++) {
            int id = i % 3 == 0 ? sequence.next() : allocator.nextId();
            assertTrue(id > previous, "id " + id + " after " + previous);
            previous = id;
        }
    }

    @Test
    void incrementSkipsPastIdsAlreadyUsedByRequests() {
        for (int i = 0; i < 5; i++) {
            sequence.next();
        }
        transport.deliver(new NextValidIdEvent(3));

        assertEquals(6, allocator(OrderIdStrategy.INCREMENT, 1).nextId());
    }

    @Test
    void incrementWithoutSeedTimesOut() {
        AllocationTimeoutException error = assertThrows(AllocationTimeoutException.class,
                () -> allocator(OrderIdStrategy.INCREMENT, 1).nextId());

        assertEquals(1, error.getAttempts());
    }

    @Test
    void incrementResetWaitsForAFreshSeed() {
        transport.deliver(new NextValidIdEvent(10));
        IncrementingOrderIdAllocator allocator = (IncrementingOrderIdAllocator) allocator(OrderIdStrategy.INCREMENT, 1);
        assertEquals(10, allocator.nextId());

        queue.reset(new IllegalStateException("reconnect"));
        allocator.reset();
        transport.deliver(new NextValidIdEvent(500));

        assertEquals(500, allocator.nextId());
    }

    @Test
    void concurrentIncrementAllocationsAreUnique() throws Exception {
        transport.deliver(new NextValidIdEvent(1));
        OrderIdAllocator allocator = allocator(OrderIdStrategy.INCREMENT, 1);
        Set<Integer> ids = ConcurrentHashMap.newKeySet();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 100; i++) {
                        ids.add(allocator.nextId());
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(400, ids.size());
    }

    // ==================== RETRY / BASIC ====================

    @Test
    void retryReissuesAfterADroppedResponse() {
        AtomicInteger calls = new AtomicInteger();
        transport.on(CommandType.REQUEST_IDS, command -> calls.incrementAndGet() == 1
                ? List.<BrokerEvent>of()
                : List.<BrokerEvent>of(new NextValidIdEvent(42)));

        assertEquals(42, allocator(OrderIdStrategy.RETRY, 3).nextId());
        assertEquals(2, transport.commands(CommandType.REQUEST_IDS).size());
        assertEquals(0, queue.waiting());
    }

    @Test
    void retryGivesUpAfterTheBudget() {
        AllocationTimeoutException error = assertThrows(AllocationTimeoutException.class,
                () -> allocator(OrderIdStrategy.RETRY, 3).nextId());

        assertEquals(3, error.getAttempts());
        assertEquals(ATTEMPT_TIMEOUT, error.getTimeout());
        assertEquals(3, transport.commands(CommandType.REQUEST_IDS).size());
        assertEquals(0, queue.waiting());
    }

    @Test
    void basicMakesASingleAttempt() {
        OrderIdAllocator allocator = allocator(OrderIdStrategy.BASIC, 5);

        AllocationTimeoutException error = assertThrows(AllocationTimeoutException.class, allocator::nextId);

        assertEquals(1, error.getAttempts());
        assertEquals(OrderIdStrategy.BASIC, allocator.getStrategy());
        assertEquals(1, transport.commands(CommandType.REQUEST_IDS).size());
    }

    @Test
    void repeatedBrokerValuesStillGiveUniqueIds() {
        transport.on(CommandType.REQUEST_IDS, command -> List.of(new NextValidIdEvent(10)));
        OrderIdAllocator allocator = allocator(OrderIdStrategy.RETRY, 3);

        assertEquals(10, allocator.nextId());
        assertEquals(11, allocator.nextId());
        assertEquals(12, allocator.nextId());
    }

    @Test
    void unsolicitedValueAtConnectIsNotHandedOut() {
        transport.deliver(new NextValidIdEvent(1));
        transport.on(CommandType.REQUEST_IDS, command -> List.of(new NextValidIdEvent(77)));

        assertEquals(77, allocator(OrderIdStrategy.RETRY, 1).nextId());
    }
}
