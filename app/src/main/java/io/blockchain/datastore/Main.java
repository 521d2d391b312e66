package io.blockchain.datastore;

import io.blockchain.datastore.config.DataStoreConfig;
import io.blockchain.datastore.consensus.ChainInfo;
import io.blockchain.datastore.consensus.InMemoryConsensusSet;
import io.blockchain.datastore.control.ControlServer;
import io.blockchain.datastore.datastore.DataStore;
import io.blockchain.datastore.datastore.Namespace;
import io.blockchain.datastore.datastore.SubAction;
import io.blockchain.datastore.datastore.SubEvent;
import io.blockchain.datastore.datastore.TaggedRecord;
import io.blockchain.datastore.metrics.ReplicationMetrics;
import io.blockchain.datastore.protocol.Block;
import io.blockchain.datastore.protocol.BlockHeader;
import io.blockchain.datastore.protocol.BlockId;
import io.blockchain.datastore.protocol.Specifier;
import io.blockchain.datastore.protocol.Transaction;
import io.blockchain.datastore.storage.Database;
import io.blockchain.datastore.storage.DatabaseException;
import io.blockchain.datastore.storage.RocksDBDatabase;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    static final String DEMO_NAMESPACE = "demo";

    public static void main(String[] args) throws Exception {
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        DataStoreConfig config = options.resolveConfig();
        ChainInfo chainInfo = ChainInfo.defaultLocal().withMaturityDelay(config.maturityDelay);
        Path persistPath = config.persistDir.toAbsolutePath().normalize();

        // Standalone runs replicate from an in-memory chain; a node embeds the datastore with its own consensus set.
        InMemoryConsensusSet chain = new InMemoryConsensusSet();
        RocksDBDatabase database = RocksDBDatabase.open(config.databaseDir, config.pollIntervalMillis);
        DataStore dataStore;
        try {
            warnUnresumableCheckpoints(database);
            dataStore = DataStore.open(chain, database, persistPath, chainInfo);
        } catch (Exception e) {
            database.close();
            throw e;
        }

        ControlServer controlServer = null;
        try {
            if (options.enableControl()) {
                controlServer = new ControlServer(config.controlBind, config.controlPort, database::publish);
                controlServer.start();
            }

            if (options.demo()) {
                runDemoFlow(chain, database, dataStore);
            }

            if (options.keepAlive()) {
                CountDownLatch shutdownLatch = new CountDownLatch(1);
                Runtime.getRuntime().addShutdownHook(new Thread(shutdownLatch::countDown, "chain-datastore-shutdown"));
                LOG.info("Datastore running. Press CTRL+C to exit.");
                shutdownLatch.await();
            }
        } finally {
            if (controlServer != null) {
                controlServer.stop();
            }
            dataStore.close();
        }
    }

    /**
     * The standalone chain starts empty on every run, so checkpoints persisted by an earlier
     * run point at changes it has never published and their managers stay idle.
     *
     * @return number of such checkpoints
     */
    static int warnUnresumableCheckpoints(Database database) throws DatabaseException {
        Set<Namespace> stale = database.loadManagerStates().keySet();
        if (!stale.isEmpty()) {
            LOG.warning(() -> stale.size() + " namespace checkpoint(s) from a previous run cannot resume on the in-memory chain "
                    + stale + "; send unsubscribe/subscribe to restart them");
        }
        return stale.size();
    }

    private static void runDemoFlow(InMemoryConsensusSet chain, RocksDBDatabase database, DataStore dataStore) throws InterruptedException {
        Namespace ns = Namespace.loadString(DEMO_NAMESPACE);
        database.publish(new SubEvent(SubAction.START, ns, 0L).toPayload());
        for (int i = 0; i < 50 && dataStore.manager(ns).map(m -> !m.isSubscribed()).orElse(true); i++) {
            Thread.sleep(100L);
        }

        byte[] parent = new byte[BlockId.LENGTH];
        long timestamp = System.currentTimeMillis() / 1000L;
        for (int height = 0; height < 3; height++) {
            byte[] payload = ("demo record " + height).getBytes(StandardCharsets.UTF_8);
            Transaction tx = Transaction.builder()
                    .arbitraryData(new TaggedRecord(Specifier.EMPTY, ns, payload).toBytes())
                    .build();
            Block block = new Block(new BlockHeader(parent, height, timestamp + height), List.of(tx));
            chain.extend(List.of(block));
            parent = block.id().bytes();
        }

        dataStore.manager(ns).ifPresent(m -> LOG.info("Demo namespace state: " + m.state()));
        LOG.info("=== Metrics ===\n" + ReplicationMetrics.scrapeMetrics());
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path configFile,
            Path persistDir,
            int maturityDelay,
            String controlBind,
            int controlPort,
            boolean enableControl,
            boolean demo,
            boolean keepAlive
    ) {
        static CliOptions parse(String[] args) {
            Path configFile = null;
            Path persistDir = envPath("CHAIN_DATASTORE_PERSIST_DIR", null);
            int maturityDelay = -1;
            String controlBind = null;
            int controlPort = -1;
            boolean enableControl = true;
            boolean demo = false;
            boolean keepAlive = false;
            boolean showHelp = false;
            String error = null;

            String portEnv = System.getenv("CHAIN_DATASTORE_CONTROL_PORT");
            if (portEnv != null && !portEnv.isBlank()) {
                try {
                    controlPort = parsePort(portEnv, "CHAIN_DATASTORE_CONTROL_PORT");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--config=")) {
                        configFile = Path.of(arg.substring("--config=".length()));
                    } else if (arg.startsWith("--persist-dir=")) {
                        persistDir = Path.of(arg.substring("--persist-dir=".length()));
                    } else if (arg.startsWith("--maturity-delay=")) {
                        try {
                            maturityDelay = parsePositiveInt(arg.substring("--maturity-delay=".length()), "--maturity-delay");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--control-bind=")) {
                        controlBind = arg.substring("--control-bind=".length());
                    } else if (arg.startsWith("--control-port=")) {
                        try {
                            controlPort = parsePort(arg.substring("--control-port=".length()), "--control-port");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.equals("--no-control")) {
                        enableControl = false;
                    } else if (arg.equals("--demo")) {
                        demo = true;
                    } else if (arg.equals("--no-demo")) {
                        demo = false;
                    } else if (arg.equals("--keep-alive")) {
                        keepAlive = true;
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (controlBind != null && controlBind.isBlank()) {
                controlBind = null;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    configFile,
                    persistDir,
                    maturityDelay,
                    controlBind,
                    controlPort,
                    enableControl,
                    demo,
                    keepAlive
            );
        }

        /** Config file (or defaults) with the command line applied on top. */
        DataStoreConfig resolveConfig() {
            DataStoreConfig config = configFile != null ? DataStoreConfig.load(configFile) : DataStoreConfig.defaults();
            if (persistDir != null) {
                config = config.withPersistDir(persistDir);
            }
            if (maturityDelay > 0) {
                config = config.withMaturityDelay(maturityDelay);
            }
            if (controlBind != null || controlPort >= 0) {
                config = config.withControl(
                        controlBind != null ? controlBind : config.controlBind,
                        controlPort >= 0 ? controlPort : config.controlPort);
            }
            return config;
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: chain-datastore [options]

Options:
  --help, -h                 Show this help message and exit
  --config=<file>            JSON config file (persistDir, databaseDir, maturityDelay,
                             controlBind, controlPort, pollIntervalMillis)
  --persist-dir=<path>       Directory for the datastore log and database (default ./data/datastore)
  --maturity-delay=<n>       Blocks kept in each namespace's revert window (default 144)
  --control-bind=<host>      Bind address for the control listener (default 127.0.0.1)
  --control-port=<port>      Port for the control listener (default 7480)
  --no-control               Do not start the control listener
  --demo / --no-demo         Subscribe to namespace "demo" and replicate a few generated blocks
  --keep-alive               Keep running until interrupted

Control messages (one per line):
  subscribe:<namespace>[:<start timestamp>]
  unsubscribe:<namespace>

The standalone runner replicates from an in-memory chain that starts empty, so
namespaces persisted by an earlier run stay idle until they are unsubscribed and
subscribed again.

Environment overrides:
  CHAIN_DATASTORE_PERSIST_DIR   Override --persist-dir
  CHAIN_DATASTORE_CONTROL_PORT  Override --control-port
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static int parsePort(String value, String flag) {
            try {
                int port = Integer.parseInt(value);
                if (port < 0 || port > 65_535) {
                    throw new NumberFormatException();
                }
                return port;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port for " + flag + ": " + value);
            }
        }

        private static int parsePositiveInt(String value, String flag) {
            try {
                int parsed = Integer.parseInt(value);
                if (parsed <= 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
