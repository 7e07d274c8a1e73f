package io.phaseline.daemon;

import com.fasterxml.jackson.databind.JsonNode;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.error.DaemonTimeoutException;
import io.phaseline.error.DaemonUnavailableException;
import io.phaseline.error.ErrorKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class DaemonClientTest {

    @Test
    void disabledAutoStartFailsFastWithoutSpawning() throws Exception {
        Path root = Files.createTempDirectory("phaseline-daemon-");
        try {
            PhaselineConfig config = PhaselineConfig.fromRoot(root);
            AtomicInteger launches = new AtomicInteger();
            try (DaemonClient client = new DaemonClient(config.socketPath(), false, 1_000L, 1_000L, () -> {
                launches.incrementAndGet();
                return null;
            })) {
                long started = System.currentTimeMillis();
                DaemonUnavailableException ex = Assertions.assertThrows(DaemonUnavailableException.class,
                        () -> client.call("health", null));
                Assertions.assertEquals(ErrorKind.DAEMON_UNAVAILABLE, ex.kind());
                Assertions.assertTrue(System.currentTimeMillis() - started < 1_000L);
                Assertions.assertEquals(0, launches.get());
                Assertions.assertFalse(client.spawnAttempted());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void autoStartSpawnsOnceAndReusesTheServer() throws Exception {
        Path root = Files.createTempDirectory("phaseline-daemon-");
        PhaselineConfig config = PhaselineConfig.fromRoot(root);
        List<DaemonServer> servers = new ArrayList<>();
        AtomicInteger launches = new AtomicInteger();
        DaemonLauncher inProcess = () -> {
            launches.incrementAndGet();
            DaemonServer server = new DaemonServer(config, DaemonServerTest.settings(4));
            server.start();
            servers.add(server);
            return null;
        };
        try (DaemonClient client = new DaemonClient(config.socketPath(), true, 5_000L, 5_000L, inProcess)) {
            DaemonClient.EnsureRunningResult first = client.ensureRunning();
            Assertions.assertTrue(first.spawned());
            Assertions.assertFalse(first.alreadyRunning());

            JsonNode health = client.call("health", null);
            Assertions.assertTrue(health.path("ok").asBoolean());
            client.call("list", null);

            DaemonClient.EnsureRunningResult again = client.ensureRunning();
            Assertions.assertTrue(again.alreadyRunning());
            Assertions.assertEquals(1, launches.get());
        } finally {
            for (DaemonServer server : servers) {
                server.stop();
            }
            deleteRecursively(root);
        }
    }

    @Test
    void staleSocketFileIsReplacedBySpawnedServer() throws Exception {
        Path root = Files.createTempDirectory("phaseline-daemon-");
        PhaselineConfig config = PhaselineConfig.fromRoot(root);
        Files.createDirectories(config.daemonDir());
        Files.writeString(config.socketPath(), "left behind", StandardCharsets.UTF_8);
        List<DaemonServer> servers = new ArrayList<>();
        AtomicInteger launches = new AtomicInteger();
        DaemonLauncher inProcess = () -> {
            launches.incrementAndGet();
            DaemonServer server = new DaemonServer(config, DaemonServerTest.settings(4));
            server.start();
            servers.add(server);
            return null;
        };
        try (DaemonClient client = new DaemonClient(config.socketPath(), true, 5_000L, 5_000L, inProcess)) {
            JsonNode health = client.call("health", null);
            Assertions.assertTrue(health.path("ok").asBoolean());
            Assertions.assertEquals(1, launches.get());
            Assertions.assertTrue(client.spawnAttempted());
        } finally {
            for (DaemonServer server : servers) {
                server.stop();
            }
            deleteRecursively(root);
        }
    }

    @Test
    void serverThatNeverAppearsTimesOutOnStartupAndIsNotRespawned() throws Exception {
        Path root = Files.createTempDirectory("phaseline-daemon-");
        try {
            PhaselineConfig config = PhaselineConfig.fromRoot(root);
            AtomicInteger launches = new AtomicInteger();
            try (DaemonClient client = new DaemonClient(config.socketPath(), true, 1_000L, 200L, () -> {
                launches.incrementAndGet();
                return null;
            })) {
                Assertions.assertThrows(DaemonUnavailableException.class, client::ensureRunning);
                Assertions.assertThrows(DaemonUnavailableException.class, client::ensureRunning);
                Assertions.assertEquals(1, launches.get());
            }

            try (DaemonClient failing = new DaemonClient(config.socketPath(), true, 1_000L, 200L, () -> {
                throw new IOException("no java");
            })) {
                DaemonUnavailableException ex = Assertions.assertThrows(DaemonUnavailableException.class,
                        failing::ensureRunning);
                Assertions.assertTrue(ex.getMessage().contains("no java"));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void silentServerTriggersRequestTimeout() throws Exception {
        Path root = Files.createTempDirectory("phaseline-daemon-");
        PhaselineConfig config = PhaselineConfig.fromRoot(root);
        Files.createDirectories(config.daemonDir());
        try (ServerSocketChannel silent = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
            silent.bind(UnixDomainSocketAddress.of(config.socketPath()));
            try (DaemonClient client = new DaemonClient(config.socketPath(), false, 200L, 200L, () -> null)) {
                DaemonTimeoutException ex = Assertions.assertThrows(DaemonTimeoutException.class,
                        () -> client.call("health", null));
                Assertions.assertEquals(ErrorKind.TIMEOUT, ex.kind());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void launcherPassesOnlyAllowListedEnvironment() {
        PhaselineConfig config = PhaselineConfig.fromRoot(Path.of("/tmp/phaseline-env"));
        ProcessDaemonLauncher launcher = new ProcessDaemonLauncher(config,
                Map.of("PATH", "/usr/bin", "HOME", "/home/u", "AWS_SECRET_ACCESS_KEY", "s3cr3t"));
        Map<String, String> env = new HashMap<>();
        env.put("INHERITED_TOKEN", "x");
        launcher.applyEnvironment(env);
        Assertions.assertEquals(Map.of("PATH", "/usr/bin", "HOME", "/home/u"), env);

        List<String> command = launcher.command();
        Assertions.assertEquals("io.phaseline.Main", command.get(3));
        Assertions.assertEquals(List.of("--root", config.rootDir().toString(), "daemon", "serve"),
                command.subList(4, command.size()));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
