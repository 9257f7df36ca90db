package io.fieldsync.server;

import io.fieldsync.core.DefaultFieldMerger;
import io.fieldsync.core.VersionedFieldCatalog;
import io.fieldsync.server.presence.BroadcastHub;
import io.fieldsync.server.presence.PresenceRegistry;
import io.fieldsync.server.transport.WebSocketGateway;
import io.fieldsync.storage.DurableEntityStore;
import io.fieldsync.storage.DurableEventLog;
import io.fieldsync.storage.FileSnapshotter;
import io.fieldsync.storage.FileWal;
import io.fieldsync.storage.SnapshotPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a single sync server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Wire storage (entity WAL + snapshots, event WAL).
 *  - Create the presence registry, broadcast hub and SyncService.
 *  - Start the HTTP + WebSocket server.
 *
 * On-disk layout under the data dir:
 *   entities/wal/        entity WAL segments (compacted after each snapshot)
 *   entities/snapshots/  entity snapshots
 *   events/              event log segments (never compacted)
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private static final long WAL_ROTATE_BYTES = 64L * 1024 * 1024; // rotate ~64MB

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);
        Path data = Path.of(cfg.dataDir());

        // ------ Storage Layer -------
        var entityWal = new FileWal(data.resolve("entities").resolve("wal"), WAL_ROTATE_BYTES);
        var snaps = new FileSnapshotter(data.resolve("entities").resolve("snapshots"));
        var store = new DurableEntityStore(entityWal, snaps, new SnapshotPolicy(cfg.snapshotEvery()));
        var eventWal = new FileWal(data.resolve("events"), WAL_ROTATE_BYTES);
        var events = new DurableEventLog(eventWal);

        VersionedFieldCatalog catalog = cfg.fieldCatalogPath() == null || cfg.fieldCatalogPath().isBlank()
                ? VersionedFieldCatalog.defaults()
                : FieldCatalogLoader.fromJsonFile(Path.of(cfg.fieldCatalogPath()));

        // ------ Sync engine + real-time fan-out ------
        var hub = new BroadcastHub(new PresenceRegistry());
        var sync = new SyncService(store, events, hub, catalog,
                new DefaultFieldMerger(Clock.systemUTC()), Clock.systemUTC(), cfg.casRetries());

        // ------ HTTP + WebSocket layer ------
        var web = new WebServer(cfg.httpPort(), sync, new WebSocketGateway(hub), cfg.eventPageLimit());
        web.start();
        log.info(() -> String.format("fieldsync listening on http://localhost:%d (ws at /ws), data in %s, %d entities loaded",
                cfg.httpPort(), data.toAbsolutePath(), store.size()));

        // Shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "error stopping web server", e);
            }
            try {
                entityWal.close();
                eventWal.close();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "error closing WAL", e);
            }
        }));
    }

    private static void configureLogging() throws IOException {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }
}
