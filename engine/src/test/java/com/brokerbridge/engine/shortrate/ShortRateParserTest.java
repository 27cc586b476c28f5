package com.brokerbridge.engine.shortrate;

import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShortRateParserTest {

    private static final String HEADER = "#SYM|CUR|NAME|CON|ISIN|REBATERATE|FEERATE|AVAILABLE|";

    private final ShortRateParser parser = new ShortRateParser();

    @Test
    void parsesRowsByHeaderName() throws Exception {
        String file = String.join("\n",
                "#BOF|2024.03.04|09:45:02",
                HEADER,
                "AAPL|USD|APPLE INC|265598|US0378331005|4.8125|0.25|&gt;10000000|",
                "AT&amp;T|USD|AT&amp;T INC|37018770|US00206R1023|NA|NA|50000|",
                "#EOF|2");

        List<ShortRate> rates = parser.parse("usa", new StringReader(file));

        assertEquals(2, rates.size());
        ShortRate aapl = rates.get(0);
        assertEquals("usa", aapl.source());
        assertEquals("AAPL", aapl.symbol());
        assertEquals("USD", aapl.currency());
        assertEquals("APPLE INC", aapl.name());
        assertEquals(265598L, aapl.conId());
        assertEquals(4.8125, aapl.rebateRate());
        assertEquals(0.25, aapl.feeRate());
        assertEquals(">10000000", aapl.available());

        ShortRate att = rates.get(1);
        assertEquals("AT&T", att.symbol());
        assertNull(att.rebateRate());
        assertNull(att.feeRate());
    }

    @Test
    void laterFilesMustRepeatTheHeader() throws Exception {
        parser.parse("usa", new StringReader(HEADER + "\nAAPL|USD|APPLE INC|265598||1|2|3|"));

        assertEquals(1, parser.parse("canada", new StringReader(HEADER + "\nRY|CAD|ROYAL BANK|4458964||1|2|3|"))
                .size());
        assertThrows(IllegalStateException.class,
                () -> parser.parse("uk", new StringReader("#SYM|CUR|NAME|CON|\nBP|GBP|BP PLC|1|")));
    }

    @Test
    void rowBeforeHeaderIsRefused() {
        assertThrows(IllegalStateException.class,
                () -> parser.parse("usa", new StringReader("AAPL|USD|APPLE INC|265598|")));
    }

    @Test
    void unescapesNumericEntities() {
        assertEquals("L'OREAL", ShortRateParser.unescape("L&#39;OREAL"));
        assertEquals("A&B", ShortRateParser.unescape("A&#x26;B"));
        assertEquals("plain", ShortRateParser.unescape("plain"));
    }
}
