package com.brokerbridge.engine.id;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class NextValidIdQueueTest {

    @Test
    void valuesGoToWaitersInOrder() {
        NextValidIdQueue queue = new NextValidIdQueue("test");
        CompletableFuture<Integer> first = queue.await();
        CompletableFuture<Integer> second = queue.await();

        queue.onNextValidId(5);
        queue.onNextValidId(6);

        assertEquals(5, first.join());
        assertEquals(6, second.join());
        assertEquals(5, queue.seed().join());
    }

    @Test
    void abandonedWaiterGetsNothing() {
        NextValidIdQueue queue = new NextValidIdQueue("test");
        CompletableFuture<Integer> abandoned = queue.await();
        queue.abandon(abandoned);

        queue.onNextValidId(9);

        assertFalse(abandoned.isDone());
        assertEquals(0, queue.waiting());
    }

    @Test
    void resetFailsWaitersAndRenewsTheSeed() {
        NextValidIdQueue queue = new NextValidIdQueue("test");
        queue.onNextValidId(1);
        CompletableFuture<Integer> waiter = queue.await();

        queue.reset(new IllegalStateException("gone"));

        ExecutionException error = assertThrows(ExecutionException.class, waiter::get);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertFalse(queue.seed().isDone());

        queue.onNextValidId(40);
        assertEquals(40, queue.seed().join());
    }
}
