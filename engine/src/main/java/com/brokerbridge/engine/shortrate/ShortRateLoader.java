package com.brokerbridge.engine.shortrate;

import com.brokerbridge.engine.table.SessionTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fills the {@code short_rates} table from a {@link ShortRateSource}.
 *
 * <p>Files are written as they are parsed. A failed download is logged and leaves the
 * rows of the files read before it in place.</p>
 */
public class ShortRateLoader {

    private static final Logger log = LoggerFactory.getLogger(ShortRateLoader.class);

    private final String sessionName;
    private final ShortRateSource source;
    private final SessionTables tables;
    private final AtomicBoolean loaded = new AtomicBoolean();

    public ShortRateLoader(String sessionName, ShortRateSource source, SessionTables tables) {
        this.sessionName = sessionName;
        this.source = source;
        this.tables = tables;
    }

    /**
     * Download unless an earlier call already did.
     *
     * @return rows written by this call
     */
    public int loadOnce() {
        if (!loaded.compareAndSet(false, true)) {
            return 0;
        }
        return load();
    }

    /**
     * @return rows written
     */
    public int load() {
        ShortRateParser parser = new ShortRateParser();
        int[] written = new int[1];
        try {
            source.download((fileName, content) -> {
                String name = fileName.endsWith(".txt") ? fileName.substring(0, fileName.length() - 4) : fileName;
                for (ShortRate rate : parser.parse(name, content)) {
                    write(rate);
                    written[0]++;
                }
            });
            log.info("[{}] Loaded {} short rates from {}", sessionName, written[0], source);
        } catch (IOException | IllegalStateException | IllegalArgumentException e) {
            log.warn("[{}] Short rate download from {} failed after {} rows: {}", sessionName, source,
                    written[0], e.getMessage());
        }
        return written[0];
    }

    private void write(ShortRate rate) {
        tables.row(SessionTables.SHORT_RATES)
                .add(rate.source())
                .add(rate.symbol())
                .add(rate.currency())
                .add(rate.name())
                .add(rate.conId())
                .add(rate.rebateRate())
                .add(rate.feeRate())
                .add(rate.available())
                .write();
    }
}
