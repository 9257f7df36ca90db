package io.fieldsync.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:          HTTP API and WebSocket port
 *  - dataDir:           root for entity WAL, snapshots and the event log
 *  - fieldCatalogPath:  optional JSON file overriding versioned-field sets
 *  - casRetries:        compare-and-swap attempts per update before giving up
 *  - eventPageLimit:    default page size of GET /productions/{id}/events
 *  - snapshotEvery:     entity writes between snapshots
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        String fieldCatalogPath,
        int casRetries,
        int eventPageLimit,
        int snapshotEvery
) {
    public static final int DEFAULT_HTTP_PORT = 8080;
    public static final String DEFAULT_DATA_DIR = "./data";
    public static final int DEFAULT_CAS_RETRIES = 3;
    public static final int DEFAULT_EVENT_PAGE_LIMIT = 100;
    public static final int DEFAULT_SNAPSHOT_EVERY = 10_000;

    public ServerConfig {
        if (httpPort <= 0 || httpPort > 65535) throw new IllegalArgumentException("http-port out of range");
        if (casRetries < 1) throw new IllegalArgumentException("cas-retries must be >= 1");
        if (eventPageLimit < 1) throw new IllegalArgumentException("event-page-limit must be >= 1");
        if (snapshotEvery < 1) throw new IllegalArgumentException("snapshot-every must be >= 1");
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_HTTP_PORT, DEFAULT_DATA_DIR, null,
                DEFAULT_CAS_RETRIES, DEFAULT_EVENT_PAGE_LIMIT, DEFAULT_SNAPSHOT_EVERY);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port,     -p   <port>
     *   --data-dir,      -d   <path>
     *   --field-catalog, -f   <path>
     *   --cas-retries         <n>
     *   --event-page-limit    <n>
     *   --snapshot-every      <n>
     *   --help,          -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = DEFAULT_HTTP_PORT;
        String dataDir = DEFAULT_DATA_DIR;
        String fieldCatalog = null;
        int casRetries = DEFAULT_CAS_RETRIES;
        int eventPageLimit = DEFAULT_EVENT_PAGE_LIMIT;
        int snapshotEvery = DEFAULT_SNAPSHOT_EVERY;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = parseInt(args, ++i);
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--field-catalog", "-f" -> {
                    ensureValue(args, i);
                    fieldCatalog = args[++i];
                }

                case "--cas-retries" -> {
                    ensureValue(args, i);
                    casRetries = parseInt(args, ++i);
                }

                case "--event-page-limit" -> {
                    ensureValue(args, i);
                    eventPageLimit = parseInt(args, ++i);
                }

                case "--snapshot-every" -> {
                    ensureValue(args, i);
                    snapshotEvery = parseInt(args, ++i);
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        try {
            return new ServerConfig(httpPort, dataDir, fieldCatalog, casRetries, eventPageLimit, snapshotEvery);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(1);
            throw e; // unreachable
        }
    }

    private static int parseInt(String[] args, int i) {
        try {
            return Integer.parseInt(args[i]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid value for " + args[i - 1] + ": " + args[i]);
            System.exit(1);
            throw e; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port,     -p   HTTP/WebSocket port (default: 8080)
              --data-dir,      -d   Data directory (default: ./data)
              --field-catalog, -f   JSON file overriding versioned fields per entity type (optional)
              --cas-retries         Compare-and-swap attempts per update (default: 3)
              --event-page-limit    Default number of events per page (default: 100)
              --snapshot-every      Entity writes between snapshots (default: 10000)
              --help,          -h   Show this help message
            """);
        System.exit(0);
    }
}
