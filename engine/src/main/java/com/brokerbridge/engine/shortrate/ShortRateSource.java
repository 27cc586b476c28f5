package com.brokerbridge.engine.shortrate;

import java.io.IOException;
import java.io.Reader;

/**
 * Where the short-stock availability files come from.
 */
public interface ShortRateSource {

    /**
     * Hand every available file to {@code handler}, one after the other.
     *
     * @throws IOException if the listing or a download fails
     */
    void download(FileHandler handler) throws IOException;

    @FunctionalInterface
    interface FileHandler {
        /**
         * @param fileName the file name as published, e.g. {@code usa.txt}
         * @param content the file content; only valid during the call
         */
        void accept(String fileName, Reader content) throws IOException;
    }
}
