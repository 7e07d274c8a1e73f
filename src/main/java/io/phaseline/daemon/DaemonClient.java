package io.phaseline.daemon;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.config.PhaselineSettings;
import io.phaseline.error.DaemonCallException;
import io.phaseline.error.DaemonTimeoutException;
import io.phaseline.error.DaemonUnavailableException;
import io.phaseline.error.ErrorKind;
import io.phaseline.error.PipelineException;
import io.phaseline.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thin request/response client for the daemon socket. Each call opens its own connection and
 * carries its own deadline; a call that times out is abandoned, not cancelled server-side.
 *
 * <p>Request ids and the spawn latch belong to the instance, so independent clients in one
 * process never share them.
 */
public final class DaemonClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DaemonClient.class);
    private static final long POLL_INTERVAL_MS = 50L;

    private final Path socketPath;
    private final boolean autoStart;
    private final long requestTimeoutMs;
    private final long startupTimeoutMs;
    private final DaemonLauncher launcher;
    private final AtomicLong nextRequestId = new AtomicLong();
    private final AtomicBoolean spawnAttempted = new AtomicBoolean();
    private final ExecutorService io;
    private volatile Process child;

    public DaemonClient(PhaselineConfig config, PhaselineSettings settings) {
        this(config.socketPath(), settings.daemonAutoStart(), settings.daemonRequestTimeoutMs(),
                settings.daemonStartupTimeoutMs(), new ProcessDaemonLauncher(config));
    }

    public DaemonClient(Path socketPath, boolean autoStart, long requestTimeoutMs, long startupTimeoutMs, DaemonLauncher launcher) {
        this.socketPath = socketPath;
        this.autoStart = autoStart;
        this.requestTimeoutMs = requestTimeoutMs;
        this.startupTimeoutMs = startupTimeoutMs;
        this.launcher = launcher;
        AtomicInteger seq = new AtomicInteger();
        this.io = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "phaseline-client-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public JsonNode call(String method, JsonNode params) {
        ensureRunning();
        long id = nextRequestId.incrementAndGet();
        JsonNode request = Jsons.mapper().valueToTree(
                new DaemonRequest(method, params == null ? Jsons.mapper().createObjectNode() : params, id));

        SocketChannel channel = connectOrRecover();
        CompletableFuture<JsonNode> exchange = CompletableFuture.supplyAsync(() -> roundTrip(channel, request), io);
        JsonNode response;
        try {
            response = exchange.get(requestTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            exchange.cancel(true);
            closeQuietly(channel);
            throw new DaemonTimeoutException(method, requestTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(channel);
            throw new DaemonUnavailableException("Interrupted while waiting for daemon", e);
        } catch (ExecutionException e) {
            closeQuietly(channel);
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException) {
                throw (PipelineException) cause;
            }
            throw new DaemonUnavailableException("Daemon connection failed: " + cause, cause);
        }
        closeQuietly(channel);
        return unwrap(method, id, response);
    }

    /**
     * Makes sure the socket exists, spawning the server at most once per client instance and
     * polling for the socket until the startup deadline.
     */
    public EnsureRunningResult ensureRunning() {
        if (Files.exists(socketPath)) {
            return new EnsureRunningResult(true, false, 0L, null);
        }
        if (!autoStart) {
            throw new DaemonUnavailableException("Daemon is not running at " + socketPath + " and auto-start is disabled");
        }
        boolean spawned = false;
        if (spawnAttempted.compareAndSet(false, true)) {
            try {
                child = launcher.launch();
                spawned = true;
            } catch (IOException e) {
                throw new DaemonUnavailableException("Failed to spawn daemon: " + e.getMessage(), e);
            }
        }
        long started = System.currentTimeMillis();
        long deadline = started + startupTimeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (Files.exists(socketPath)) {
                long waited = System.currentTimeMillis() - started;
                log.debug("Daemon socket appeared after {} ms", waited);
                Process current = child;
                return new EnsureRunningResult(false, spawned, waited, current == null ? null : current.pid());
            }
            Process current = child;
            if (current != null && !current.isAlive()) {
                throw new DaemonUnavailableException("Daemon exited during startup with code " + current.exitValue());
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DaemonUnavailableException("Interrupted while waiting for daemon startup", e);
            }
        }
        throw new DaemonUnavailableException("Daemon did not come up at " + socketPath + " within " + startupTimeoutMs + " ms");
    }

    public boolean spawnAttempted() {
        return spawnAttempted.get();
    }

    @Override
    public void close() {
        io.shutdownNow();
    }

    // A socket file with nobody listening is left behind by a crashed server.
    private SocketChannel connectOrRecover() {
        try {
            return connect();
        } catch (DaemonUnavailableException e) {
            if (!autoStart || spawnAttempted.get()) {
                throw e;
            }
            log.warn("Removing stale daemon socket {}", socketPath);
            try {
                Files.deleteIfExists(socketPath);
            } catch (IOException ioe) {
                throw new DaemonUnavailableException("Cannot remove stale socket " + socketPath, ioe);
            }
            ensureRunning();
            return connect();
        }
    }

    private SocketChannel connect() {
        try {
            SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
            channel.connect(UnixDomainSocketAddress.of(socketPath));
            return channel;
        } catch (IOException e) {
            throw new DaemonUnavailableException("Cannot connect to daemon at " + socketPath + ": " + e.getMessage(), e);
        }
    }

    private static JsonNode roundTrip(SocketChannel channel, JsonNode request) {
        try {
            OutputStream out = Channels.newOutputStream(channel);
            out.write(Jsons.toCompactJson(request).getBytes(StandardCharsets.UTF_8));
            out.flush();
            JsonParser parser = Jsons.mapper().getFactory().createParser(Channels.newInputStream(channel));
            JsonNode response = Jsons.mapper().readTree(parser);
            if (response == null) {
                throw new IOException("Connection closed before a response arrived");
            }
            return response;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static JsonNode unwrap(String method, long id, JsonNode response) {
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            String kind = error.path("kind").asText(null);
            ErrorKind parsed = kind == null ? ErrorKind.INTERNAL : ErrorKind.fromTag(kind);
            JsonNode data = error.get("data");
            throw new DaemonCallException(parsed, error.path("code").asInt(ErrorKind.INTERNAL.code()),
                    error.path("message").asText("daemon error"), data);
        }
        if (response.path("id").asLong(-1L) != id) {
            throw new PipelineException(ErrorKind.INTERNAL,
                    "Daemon answered " + method + " with id " + response.path("id") + ", expected " + id);
        }
        return response.path("result");
    }

    private static void closeQuietly(SocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Close failed: {}", e.toString());
        }
    }

    public record EnsureRunningResult(boolean alreadyRunning, boolean spawned, long waitedMs, Long pid) {
    }
}
