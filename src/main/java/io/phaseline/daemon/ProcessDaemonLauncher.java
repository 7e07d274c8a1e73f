package io.phaseline.daemon;

import io.phaseline.config.PhaselineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Re-executes this JVM's classpath as {@code daemon serve}. The child gets only the allow-listed
 * environment variables, its stdin is closed and its output is appended to the daemon log.
 */
public final class ProcessDaemonLauncher implements DaemonLauncher {
    private static final Logger log = LoggerFactory.getLogger(ProcessDaemonLauncher.class);
    static final List<String> ENV_ALLOW_LIST = List.of(
            "PATH", "HOME", "USER", "LANG", "LC_ALL", "TMPDIR", "JAVA_HOME", "PHASELINE_LOG_LEVEL"
    );

    private final PhaselineConfig config;
    private final Map<String, String> parentEnv;

    public ProcessDaemonLauncher(PhaselineConfig config) {
        this(config, System.getenv());
    }

    ProcessDaemonLauncher(PhaselineConfig config, Map<String, String> parentEnv) {
        this.config = config;
        this.parentEnv = parentEnv;
    }

    @Override
    public Process launch() throws IOException {
        Files.createDirectories(config.daemonDir());
        ProcessBuilder pb = new ProcessBuilder(command());
        applyEnvironment(pb.environment());
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(config.daemonLogFile().toFile()));
        Process process = pb.start();
        process.getOutputStream().close();
        log.info("Spawned daemon pid {} for {}", process.pid(), config.rootDir());
        return process;
    }

    List<String> command() {
        Path java = Path.of(System.getProperty("java.home"), "bin", "java");
        List<String> cmd = new ArrayList<>();
        cmd.add(java.toString());
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        cmd.add("io.phaseline.Main");
        cmd.add("--root");
        cmd.add(config.rootDir().toString());
        cmd.add("daemon");
        cmd.add("serve");
        return cmd;
    }

    void applyEnvironment(Map<String, String> env) {
        env.clear();
        for (String key : ENV_ALLOW_LIST) {
            String value = parentEnv.get(key);
            if (value != null) {
                env.put(key, value);
            }
        }
    }
}
