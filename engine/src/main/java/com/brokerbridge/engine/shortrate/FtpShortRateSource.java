package com.brokerbridge.engine.shortrate;

import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Downloads every {@code *.txt} file from the broker's short-stock FTP account.
 */
public class FtpShortRateSource implements ShortRateSource {

    private static final Logger log = LoggerFactory.getLogger(FtpShortRateSource.class);

    private final String host;
    private final String user;
    private final Duration timeout;

    public FtpShortRateSource(String host, String user, Duration timeout) {
        this.host = host;
        this.user = user;
        this.timeout = timeout;
    }

    @Override
    public void download(FileHandler handler) throws IOException {
        FTPClient ftp = new FTPClient();
        int timeoutMillis = (int) timeout.toMillis();
        ftp.setConnectTimeout(timeoutMillis);
        ftp.setDefaultTimeout(timeoutMillis);
        try {
            ftp.connect(host);
            ftp.setSoTimeout(timeoutMillis);
            if (!FTPReply.isPositiveCompletion(ftp.getReplyCode())) {
                throw new IOException("FTP server " + host + " refused connection: " + ftp.getReplyString());
            }
            if (!ftp.login(user, "")) {
                throw new IOException("FTP login failed for " + user + "@" + host + ": " + ftp.getReplyString());
            }
            ftp.enterLocalPassiveMode();
            ftp.setFileType(FTP.ASCII_FILE_TYPE);

            String[] files = ftp.listNames("*.txt");
            if (files == null) {
                throw new IOException("FTP listing failed on " + host + ": " + ftp.getReplyString());
            }
            log.info("Downloading {} short rate file(s) from {}", files.length, host);
            for (String file : files) {
                retrieve(ftp, file, handler);
            }
            ftp.logout();
        } finally {
            if (ftp.isConnected()) {
                try {
                    ftp.disconnect();
                } catch (IOException e) {
                    log.debug("Error closing FTP connection to {}: {}", host, e.getMessage());
                }
            }
        }
    }

    private void retrieve(FTPClient ftp, String file, FileHandler handler) throws IOException {
        InputStream stream = ftp.retrieveFileStream(file);
        if (stream == null) {
            throw new IOException("FTP download of " + file + " failed: " + ftp.getReplyString());
        }
        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            handler.accept(file, reader);
        }
        if (!ftp.completePendingCommand()) {
            throw new IOException("FTP download of " + file + " failed: " + ftp.getReplyString());
        }
    }

    @Override
    public String toString() {
        return user + "@" + host;
    }
}
