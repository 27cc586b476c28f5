package com.brokerbridge.engine.router;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog of broker error codes: a description and a note per code, plus the codes
 * that are notices rather than failures.
 *
 * <p>Loaded from the {@code broker-error-codes} block:</p>
 * <pre>
 * broker-error-codes {
 *   informational = [2104, 2106, 2158]
 *   order-rejections = [201, 203]
 *   order-cancelled = [202]
 *   cancel-refusals = [161, 10147, 10148]
 *   messages { "200" = "No security definition has been found for the request" }
 *   notes { "200" = "..." }
 * }
 * </pre>
 */
public class ErrorCodes {

    private static final Logger log = LoggerFactory.getLogger(ErrorCodes.class);

    private final Set<Integer> informational;
    private final Set<Integer> orderRejections;
    private final Set<Integer> orderCancelled;
    private final Set<Integer> cancelRefusals;
    private final Map<Integer, String> messages;
    private final Map<Integer, String> notes;
    private final Set<Integer> reportedUnmapped = ConcurrentHashMap.newKeySet();

    public ErrorCodes(Set<Integer> informational, Set<Integer> orderRejections, Set<Integer> orderCancelled,
                      Set<Integer> cancelRefusals, Map<Integer, String> messages, Map<Integer, String> notes) {
        this.informational = Set.copyOf(informational);
        this.orderRejections = Set.copyOf(orderRejections);
        this.orderCancelled = Set.copyOf(orderCancelled);
        this.cancelRefusals = Set.copyOf(cancelRefusals);
        this.messages = Map.copyOf(messages);
        this.notes = Map.copyOf(notes);
    }

    public static ErrorCodes fromConfig(Config config) {
        return new ErrorCodes(
                new HashSet<>(config.getIntList("informational")),
                new HashSet<>(config.getIntList("order-rejections")),
                new HashSet<>(config.getIntList("order-cancelled")),
                config.hasPath("cancel-refusals") ? new HashSet<>(config.getIntList("cancel-refusals")) : Set.of(),
                codeMap(config.getConfig("messages")),
                codeMap(config.getConfig("notes")));
    }

    private static Map<Integer, String> codeMap(Config config) {
        Map<Integer, String> map = new HashMap<>();
        for (Map.Entry<String, ConfigValue> entry : config.entrySet()) {
            String code = entry.getKey().replace("\"", "");
            map.put(Integer.parseInt(code), String.valueOf(entry.getValue().unwrapped()));
        }
        return map;
    }

    /**
     * Notices (connectivity, farm status, ...) that never fail a request.
     */
    public boolean isInformational(int code) {
        return informational.contains(code);
    }

    public boolean isOrderRejection(int code) {
        return orderRejections.contains(code);
    }

    public boolean isOrderCancelled(int code) {
        return orderCancelled.contains(code);
    }

    /**
     * A cancel request the broker refused; the order itself is still live.
     */
    public boolean isCancelRefusal(int code) {
        return cancelRefusals.contains(code);
    }

    /**
     * @return the catalog description, or {@code upstreamText} for an unmapped code
     */
    public String describe(int code, String upstreamText) {
        String message = messages.get(code);
        if (message != null) {
            return message;
        }
        if (reportedUnmapped.add(code)) {
            log.warn("Unmapped broker error code {}: {}", code, upstreamText);
        }
        return upstreamText;
    }

    public String note(int code) {
        return notes.get(code);
    }
}
