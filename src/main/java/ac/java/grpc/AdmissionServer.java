package ac.java.grpc;

import ac.core.clock.SystemClock;
import ac.java.engine.AdmissionConfig;
import ac.java.engine.AdmissionEngine;
import ac.java.store.InMemoryRegistrationStore;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for role admission.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090) and lock timeout</li>
 *   <li>Graceful shutdown with timeout</li>
 *   <li>In-memory registration store, default {@link AdmissionConfig}</li>
 *   <li>Roles start unbounded; capacities are set at runtime through the SetCapacity RPC</li>
 *   <li>SystemClock for production</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * java -cp admission-control.jar ac.java.grpc.AdmissionServer              # port 9090
 * java -cp admission-control.jar ac.java.grpc.AdmissionServer 8080 10000   # port 8080, 10 s lock timeout
 * </pre>
 */
public final class AdmissionServer {

    private static final Logger log = LoggerFactory.getLogger(AdmissionServer.class);

    private static final int DEFAULT_PORT = 9090;
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final InMemoryRegistrationStore store;

    /**
     * Creates a server on the specified port with default settings.
     *
     * @param port Port to listen on
     */
    public AdmissionServer(int port) {
        this(port, AdmissionConfig.defaults());
    }

    /**
     * Creates a server with a fresh in-memory store and the given settings.
     *
     * @param port Port to listen on
     * @param config Engine settings
     */
    public AdmissionServer(int port, AdmissionConfig config) {
        this(port, new InMemoryRegistrationStore(), config);
    }

    private AdmissionServer(int port, InMemoryRegistrationStore store, AdmissionConfig config) {
        this.store = store;
        AdmissionEngine engine = AdmissionEngine.create(
            SystemClock.instance(), store.members(), store.guests(), store, config);
        this.server = ServerBuilder.forPort(port)
            .addService(new AdmissionServiceImpl(engine, store))
            .build();
    }

    /**
     * Starts the server.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        log.info("AdmissionServer started on port: {}", server.getPort());

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)...");
            try {
                AdmissionServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted: {}", e.getMessage());
            }
        }));
    }

    /**
     * Stops the server gracefully.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        if (server != null) {
            server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.info("AdmissionServer stopped.");
        }
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        if (server != null) {
            server.awaitTermination();
        }
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server != null ? server.getPort() : -1;
    }

    /**
     * Store behind the served engine, for configuring role capacities.
     *
     * @return The registration store
     */
    public InMemoryRegistrationStore store() {
        return store;
    }

    /**
     * Main entry point.
     *
     * @param args Optional: port number, lock timeout in milliseconds
     * @throws IOException if server fails to start
     * @throws InterruptedException if server is interrupted
     */
    public static void main(String[] args) throws IOException, InterruptedException {
        int port = DEFAULT_PORT;
        AdmissionConfig config = AdmissionConfig.defaults();

        try {
            if (args.length > 0) {
                port = Integer.parseInt(args[0]);
            }
            if (args.length > 1) {
                config = config.withLockTimeoutMillis(Long.parseLong(args[1]));
            }
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments {}: {}", String.join(" ", args), e.getMessage());
            System.exit(1);
        }

        AdmissionServer server = new AdmissionServer(port, config);
        server.start();
        server.blockUntilShutdown();
    }
}
