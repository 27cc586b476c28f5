package com.brokerbridge.engine.transport;

import com.brokerbridge.config.ClockProvider;
import com.brokerbridge.engine.error.BrokerSessionException;
import com.brokerbridge.engine.error.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single outbound path of a session to its {@link BrokerTransport}.
 *
 * <p>Caller-initiated commands go through {@link #send}, which holds the caller back
 * when more than {@code maxPerSecond} commands were sent in the last second. Commands
 * issued from the event receipt path use {@link #post}, which never waits.</p>
 */
public class CommandGateway {

    private static final Logger log = LoggerFactory.getLogger(CommandGateway.class);

    private static final long WINDOW_NANOS = TimeUnit.SECONDS.toNanos(1);

    private final String sessionName;
    private final BrokerTransport transport;
    private final ClockProvider clock;
    private final int maxPerSecond;

    private final Deque<Long> window = new ArrayDeque<>();
    private final AtomicLong commandsSent = new AtomicLong();
    private final AtomicLong commandsThrottled = new AtomicLong();

    /**
     * @param maxPerSecond caller command budget per second, 0 or less to disable throttling
     */
    public CommandGateway(String sessionName, BrokerTransport transport, ClockProvider clock, int maxPerSecond) {
        this.sessionName = sessionName;
        this.transport = transport;
        this.clock = clock;
        this.maxPerSecond = maxPerSecond;
    }

    /**
     * Send a caller-initiated command, waiting for rate budget if needed.
     *
     * @throws ConnectionException if the transport is not connected
     */
    public void send(OutboundCommand command) {
        acquirePermit();
        deliver(command);
    }

    /**
     * Send without throttling. Used on the receipt path, which must not block.
     *
     * @throws ConnectionException if the transport is not connected
     */
    public void post(OutboundCommand command) {
        deliver(command);
    }

    public long getCommandsSent() {
        return commandsSent.get();
    }

    public long getCommandsThrottled() {
        return commandsThrottled.get();
    }

    private void deliver(OutboundCommand command) {
        if (!transport.isConnected()) {
            throw new ConnectionException("[" + sessionName + "] Not connected, cannot send " + command.getType());
        }
        log.debug("[{}] -> {}", sessionName, command);
        transport.send(command);
        commandsSent.incrementAndGet();
    }

    private void acquirePermit() {
        if (maxPerSecond <= 0) {
            return;
        }
        boolean throttled = false;
        while (true) {
            long waitNanos;
            synchronized (window) {
                long now = clock.nanoTime();
                while (!window.isEmpty() && now - window.peekFirst() >= WINDOW_NANOS) {
                    window.pollFirst();
                }
                if (window.size() < maxPerSecond) {
                    window.addLast(now);
                    return;
                }
                waitNanos = window.peekFirst() + WINDOW_NANOS - now;
            }
            if (!throttled) {
                throttled = true;
                commandsThrottled.incrementAndGet();
                log.debug("[{}] Request rate limit of {}/s reached, waiting {} us",
                        sessionName, maxPerSecond, TimeUnit.NANOSECONDS.toMicros(waitNanos));
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.max(waitNanos, 1));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrokerSessionException("[" + sessionName + "] Interrupted while waiting for request budget", e);
            }
        }
    }
}
