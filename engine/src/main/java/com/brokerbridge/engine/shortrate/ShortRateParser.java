package com.brokerbridge.engine.shortrate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the pipe-separated short-stock files.
 *
 * <pre>
 * #BOF|2024.03.04|09:45:02
 * #SYM|CUR|NAME|CON|ISIN|REBATERATE|FEERATE|AVAILABLE|
 * AAPL|USD|APPLE INC|265598|US0378331005|4.8125|0.25|&gt;10000000|
 * #EOF|1
 * </pre>
 *
 * <p>Every file of one download must carry the same header. Columns are looked up by
 * name, so extra columns are ignored.</p>
 */
public class ShortRateParser {

    private static final Logger log = LoggerFactory.getLogger(ShortRateParser.class);

    private static final Pattern ENTITY = Pattern.compile("&(#[0-9]+|#[xX][0-9a-fA-F]+|amp|lt|gt|quot|apos);");

    private String header;
    private List<String> columns;

    /**
     * @param source the name the rows are tagged with
     * @throws IllegalStateException if the file's header differs from an earlier one
     */
    public List<ShortRate> parse(String source, Reader content) throws IOException {
        List<ShortRate> rates = new ArrayList<>();
        BufferedReader reader = content instanceof BufferedReader
                ? (BufferedReader) content : new BufferedReader(content);
        String line;
        while ((line = reader.readLine()) != null) {
            line = unescape(line.strip());
            if (line.isEmpty() || line.startsWith("#BOF") || line.startsWith("#EOF")) {
                continue;
            }
            if (line.endsWith("|")) {
                line = line.substring(0, line.length() - 1);
            }
            if (line.startsWith("#")) {
                acceptHeader(line.substring(1));
            } else if (columns == null) {
                throw new IllegalStateException("Row before header in " + source + ": " + line);
            } else {
                rates.add(toRate(source, line.split("\\|", -1)));
            }
        }
        return rates;
    }

    private void acceptHeader(String line) {
        if (header == null) {
            header = line;
            columns = Arrays.asList(line.split("\\|", -1));
        } else if (!header.equals(line)) {
            throw new IllegalStateException("Mismatched headers: " + header + " " + line);
        }
    }

    private ShortRate toRate(String source, String[] fields) {
        return new ShortRate(source,
                field(fields, "SYM"),
                field(fields, "CUR"),
                field(fields, "NAME"),
                parseLong(field(fields, "CON")),
                parseDouble(field(fields, "REBATERATE")),
                parseDouble(field(fields, "FEERATE")),
                field(fields, "AVAILABLE"));
    }

    private String field(String[] fields, String column) {
        int index = columns.indexOf(column);
        if (index < 0 || index >= fields.length) {
            return null;
        }
        String value = fields[index].strip();
        return value.isEmpty() ? null : value;
    }

    private static Long parseLong(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.debug("Not a contract id: {}", value);
            return null;
        }
    }

    private static Double parseDouble(String value) {
        if (value == null || "NA".equalsIgnoreCase(value)) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Not a rate: {}", value);
            return null;
        }
    }

    static String unescape(String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        Matcher matcher = ENTITY.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(decode(matcher.group(1))));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String decode(String entity) {
        switch (entity) {
            case "amp":
                return "&";
            case "lt":
                return "<";
            case "gt":
                return ">";
            case "quot":
                return "\"";
            case "apos":
                return "'";
            default:
                int codePoint = entity.charAt(1) == 'x' || entity.charAt(1) == 'X'
                        ? Integer.parseInt(entity.substring(2), 16)
                        : Integer.parseInt(entity.substring(1));
                return new String(Character.toChars(codePoint));
        }
    }
}
