package io.blockchain.datastore.datastore;

import io.blockchain.datastore.consensus.ChainInfo;

import java.io.Closeable;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * File log of a datastore: {@code <persistDir>/datastore.log}, attached to the
 * {@code io.blockchain.datastore} logger while the datastore is open.
 */
final class DataStoreLog implements Closeable {
    static final String LOG_FILE = "datastore.log";
    static final String PREFIX = "[DataStore]:";

    private static final Logger ROOT = Logger.getLogger("io.blockchain.datastore");

    private final FileHandler handler;

    private DataStoreLog(FileHandler handler) {
        this.handler = handler;
    }

    static DataStoreLog open(Path persistDir, ChainInfo chainInfo) throws IOException {
        Files.createDirectories(persistDir);
        FileHandler handler = new FileHandler(persistDir.resolve(LOG_FILE).toString(), true);
        handler.setFormatter(new PrefixFormatter(PREFIX));
        ROOT.addHandler(handler);
        ROOT.info(() -> "Datastore log opened for chain " + chainInfo.name() + " (" + chainInfo.network()
                + ", maturity delay " + chainInfo.maturityDelay() + ")");
        return new DataStoreLog(handler);
    }

    @Override
    public void close() {
        ROOT.removeHandler(handler);
        handler.close();
    }

    static final class PrefixFormatter extends Formatter {
        private final String prefix;

        PrefixFormatter(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public String format(LogRecord record) {
            StringBuilder sb = new StringBuilder(prefix)
                    .append(' ').append(Instant.ofEpochMilli(record.getMillis()))
                    .append(' ').append(record.getLevel().getName())
                    .append(' ').append(formatMessage(record))
                    .append(System.lineSeparator());
            if (record.getThrown() != null) {
                StringWriter trace = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(trace));
                sb.append(trace);
            }
            return sb.toString();
        }
    }
}
