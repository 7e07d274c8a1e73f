package io.phaseline.daemon;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.config.PhaselineSettings;
import io.phaseline.error.ErrorKind;
import io.phaseline.error.PipelineException;
import io.phaseline.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntFunction;

/**
 * Long-lived process that holds one {@link WarmBundle} and answers JSON requests over a UNIX
 * domain socket.
 *
 * <p>One worker thread per connection, at most {@code daemonMaxClients}; requests on one
 * connection are handled strictly in order. The server stops itself after
 * {@code daemonIdleTimeoutMs} without requests or open connections, which is also how a server
 * that lost an auto-start race goes away.
 */
public final class DaemonServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DaemonServer.class);

    public enum State {
        STOPPED,
        STARTING,
        RUNNING,
        STOPPING
    }

    private final PhaselineConfig config;
    private final PhaselineSettings settings;
    private final IntFunction<WarmBundle> bundleFactory;
    private final RequestDispatcher dispatcher = new RequestDispatcher();
    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);
    private final AtomicReference<WarmBundle> bundle = new AtomicReference<>();
    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicInteger activeConnections = new AtomicInteger();
    private final AtomicLong requestCount = new AtomicLong();
    private final AtomicBoolean shutdownRequested = new AtomicBoolean();
    private final Set<SocketChannel> connections = ConcurrentHashMap.newKeySet();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile long lastRequestTime;
    private volatile long lastActivityTime;
    private volatile long startedAt;
    private ServerSocketChannel serverChannel;
    private ExecutorService workers;
    private ScheduledExecutorService idleWatcher;
    private Thread acceptThread;

    public DaemonServer(PhaselineConfig config, PhaselineSettings settings) {
        this(config, settings, generation -> new WarmBundle(config, settings, generation));
    }

    public DaemonServer(PhaselineConfig config, PhaselineSettings settings, IntFunction<WarmBundle> bundleFactory) {
        this.config = config;
        this.settings = settings;
        this.bundleFactory = bundleFactory;
    }

    public synchronized void start() throws IOException {
        if (!state.compareAndSet(State.STOPPED, State.STARTING)) {
            throw new IllegalStateException("Daemon server already " + state.get());
        }
        bundle.set(bundleFactory.apply(generation.incrementAndGet()).initialize());
        Path socket = config.socketPath();
        Files.createDirectories(socket.getParent());
        if (Files.deleteIfExists(socket)) {
            log.info("Removed stale socket {}", socket);
        }
        serverChannel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        serverChannel.bind(UnixDomainSocketAddress.of(socket));
        workers = Executors.newFixedThreadPool(settings.daemonMaxClients(), daemonThreads("phaseline-conn"));
        idleWatcher = Executors.newSingleThreadScheduledExecutor(daemonThreads("phaseline-idle"));
        long now = System.currentTimeMillis();
        startedAt = now;
        lastActivityTime = now;
        state.set(State.RUNNING);
        long period = Math.max(50L, Math.min(5_000L, settings.daemonIdleTimeoutMs() / 4L));
        idleWatcher.scheduleAtFixedRate(this::stopIfIdle, period, period, TimeUnit.MILLISECONDS);
        acceptThread = new Thread(this::acceptLoop, "phaseline-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        log.info("Daemon listening on {} (max {} clients)", socket, settings.daemonMaxClients());
    }

    public void awaitStop() throws InterruptedException {
        stopped.await();
    }

    public boolean awaitStop(long timeout, TimeUnit unit) throws InterruptedException {
        return stopped.await(timeout, unit);
    }

    public State state() {
        return state.get();
    }

    public void stop() {
        State current = state.get();
        if (current != State.RUNNING && current != State.STARTING) {
            return;
        }
        if (!state.compareAndSet(current, State.STOPPING)) {
            return;
        }
        log.info("Daemon stopping after {} requests", requestCount.get());
        closeQuietly(serverChannel);
        for (SocketChannel channel : connections) {
            closeQuietly(channel);
        }
        if (idleWatcher != null) {
            idleWatcher.shutdownNow();
        }
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        WarmBundle retired = bundle.getAndSet(null);
        if (retired != null) {
            retired.close();
        }
        try {
            Files.deleteIfExists(config.socketPath());
        } catch (IOException e) {
            log.warn("Could not remove socket {}: {}", config.socketPath(), e.toString());
        }
        state.set(State.STOPPED);
        stopped.countDown();
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Builds and initializes a fresh bundle, then swaps it in. Requests that already captured
     * the old bundle finish against it.
     */
    public HealthOutcome restart() {
        WarmBundle fresh = bundleFactory.apply(generation.incrementAndGet()).initialize();
        WarmBundle old = bundle.getAndSet(fresh);
        if (old != null) {
            old.close();
        }
        log.info("Warm bundle restarted (generation {})", fresh.generation());
        return health();
    }

    public HealthOutcome health() {
        Runtime rt = Runtime.getRuntime();
        WarmBundle current = bundle.get();
        long now = System.currentTimeMillis();
        return new HealthOutcome(
                state.get() == State.RUNNING && current != null && current.initialized(),
                state.get().name().toLowerCase(Locale.ROOT),
                ProcessHandle.current().pid(),
                startedAt,
                startedAt == 0L ? 0L : now - startedAt,
                requestCount.get(),
                lastRequestTime,
                activeConnections.get(),
                current == null ? 0 : current.generation(),
                new MemoryStats(rt.totalMemory() - rt.freeMemory(), rt.totalMemory(), rt.maxMemory()),
                config.socketPath().toString()
        );
    }

    private void acceptLoop() {
        while (state.get() == State.RUNNING) {
            SocketChannel channel;
            try {
                channel = serverChannel.accept();
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                log.warn("Accept failed: {}", e.toString());
                continue;
            }
            lastActivityTime = System.currentTimeMillis();
            if (state.get() != State.RUNNING) {
                reject(channel, "server is shutting down");
                continue;
            }
            if (activeConnections.incrementAndGet() > settings.daemonMaxClients()) {
                activeConnections.decrementAndGet();
                reject(channel, "max clients (" + settings.daemonMaxClients() + ") reached");
                continue;
            }
            connections.add(channel);
            workers.execute(() -> serve(channel));
        }
    }

    private void serve(SocketChannel channel) {
        try (channel) {
            InputStream in = Channels.newInputStream(channel);
            OutputStream out = Channels.newOutputStream(channel);
            JsonParser parser = Jsons.mapper().getFactory().createParser(in);
            MappingIterator<JsonNode> requests = Jsons.mapper().readerFor(JsonNode.class).readValues(parser);
            while (state.get() == State.RUNNING) {
                JsonNode node;
                try {
                    if (!requests.hasNextValue()) {
                        break;
                    }
                    node = requests.nextValue();
                } catch (JsonProcessingException e) {
                    write(out, DaemonResponse.failure(null,
                            new DaemonError(DaemonError.PARSE_ERROR, "Parse error: " + e.getOriginalMessage(), "parse_error", null)));
                    break;
                }
                write(out, handle(node));
                if (shutdownRequested.get()) {
                    new Thread(this::stop, "phaseline-stop").start();
                    break;
                }
            }
        } catch (IOException e) {
            log.debug("Connection closed: {}", e.toString());
        } finally {
            connections.remove(channel);
            activeConnections.decrementAndGet();
            lastActivityTime = System.currentTimeMillis();
        }
    }

    DaemonResponse handle(JsonNode node) {
        long now = System.currentTimeMillis();
        requestCount.incrementAndGet();
        lastRequestTime = now;
        lastActivityTime = now;
        Long id = node != null && node.path("id").canConvertToLong() ? node.path("id").asLong() : null;
        String method = node == null ? null : node.path("method").asText(null);
        if (method == null || method.isBlank()) {
            return DaemonResponse.failure(id, errorOf(new PipelineException(ErrorKind.INVALID_REQUEST, "Missing method")));
        }
        try {
            switch (method) {
                case "health":
                    return DaemonResponse.ok(id, Jsons.mapper().valueToTree(health()));
                case "restart":
                    return DaemonResponse.ok(id, Jsons.mapper().valueToTree(restart()));
                case "shutdown":
                    // Stopped by the serving thread once this response has been written.
                    shutdownRequested.set(true);
                    return DaemonResponse.ok(id, Jsons.mapper().valueToTree(health()));
                default:
                    break;
            }
            if (!dispatcher.handles(method)) {
                return DaemonResponse.failure(id,
                        new DaemonError(DaemonError.METHOD_NOT_FOUND, "Unknown method: " + method, "method_not_found", null));
            }
            WarmBundle captured = bundle.get();
            if (captured == null) {
                return DaemonResponse.failure(id, new DaemonError(DaemonError.CONNECTION_REJECTED,
                        "Server is shutting down", ErrorKind.DAEMON_UNAVAILABLE.tag(), null));
            }
            JsonNode params = node.get("params");
            JsonNode result = captured.withLock(() -> dispatcher.dispatch(captured, method, params));
            return DaemonResponse.ok(id, result);
        } catch (PipelineException e) {
            log.debug("Request {} failed: {}", method, e.getMessage());
            return DaemonResponse.failure(id, errorOf(e));
        } catch (RuntimeException e) {
            log.error("Request {} failed unexpectedly", method, e);
            return DaemonResponse.failure(id, new DaemonError(DaemonError.INTERNAL_ERROR,
                    String.valueOf(e.getMessage()), ErrorKind.INTERNAL.tag(), null));
        }
    }

    static DaemonError errorOf(PipelineException e) {
        JsonNode data = e.details().isEmpty() ? null : Jsons.mapper().valueToTree(e.details());
        return new DaemonError(e.kind().code(), e.getMessage(), e.kind().tag(), data);
    }

    private void stopIfIdle() {
        if (state.get() != State.RUNNING || activeConnections.get() > 0) {
            return;
        }
        long idle = System.currentTimeMillis() - lastActivityTime;
        if (idle >= settings.daemonIdleTimeoutMs()) {
            log.info("Idle for {} ms, shutting down", idle);
            Thread stopper = new Thread(this::stop, "phaseline-idle-stop");
            stopper.start();
        }
    }

    private static void reject(SocketChannel channel, String reason) {
        log.warn("Connection rejected: {}", reason);
        try (channel) {
            write(Channels.newOutputStream(channel), DaemonResponse.failure(null, new DaemonError(
                    DaemonError.CONNECTION_REJECTED, "Connection rejected: " + reason,
                    ErrorKind.DAEMON_UNAVAILABLE.tag(), null)));
        } catch (IOException e) {
            log.debug("Could not deliver rejection: {}", e.toString());
        }
    }

    private static void write(OutputStream out, DaemonResponse response) throws IOException {
        out.write(Jsons.toCompactJson(response).getBytes(StandardCharsets.UTF_8));
        out.write('\n');
        out.flush();
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Close failed: {}", e.toString());
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public record MemoryStats(long usedBytes, long totalBytes, long maxBytes) {
    }

    public record HealthOutcome(
            boolean ok,
            String state,
            long pid,
            long startedAt,
            long uptimeMs,
            long requestCount,
            long lastRequestTime,
            int activeConnections,
            int bundleGeneration,
            MemoryStats memory,
            String socketPath
    ) {
    }
}
