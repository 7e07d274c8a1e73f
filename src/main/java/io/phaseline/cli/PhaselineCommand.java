package io.phaseline.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.phaseline.config.PhaselineConfig;
import io.phaseline.config.PhaselineSettings;
import io.phaseline.daemon.DaemonClient;
import io.phaseline.daemon.DaemonServer;
import io.phaseline.daemon.RequestDispatcher;
import io.phaseline.daemon.WarmBundle;
import io.phaseline.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "phaseline",
        mixinStandardHelpOptions = true,
        description = "Session-based multi-phase pipeline orchestrator",
        subcommands = {
                PhaselineCommand.InitCommand.class,
                PhaselineCommand.NextCommand.class,
                PhaselineCommand.CompleteCommand.class,
                PhaselineCommand.StatusCommand.class,
                PhaselineCommand.ListCommand.class,
                PhaselineCommand.ResumeCommand.class,
                PhaselineCommand.AbortCommand.class,
                PhaselineCommand.CheckpointsCommand.class,
                PhaselineCommand.RollbackCommand.class,
                PhaselineCommand.PurgeCommand.class,
                PhaselineCommand.ToolUsageCommand.class,
                PhaselineCommand.CoverageCommand.class,
                PhaselineCommand.DaemonCommand.class
        }
)
public final class PhaselineCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(PhaselineCommand.class);
    private static final RequestDispatcher DISPATCHER = new RequestDispatcher();

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = PhaselineConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--no-daemon"}, description = "Run in this process instead of through the warm daemon")
    boolean noDaemon;

    public static CommandLine newCommandLine() {
        return new CommandLine(new PhaselineCommand())
                .setExecutionExceptionHandler(new JsonErrorReporter());
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: init | next | complete | status | list | resume | abort | checkpoints | rollback | purge | tool-usage | coverage | daemon");
    }

    PhaselineConfig config() {
        return PhaselineConfig.fromRoot(root);
    }

    JsonNode invoke(String method, ObjectNode params) {
        PhaselineConfig config = config();
        PhaselineSettings settings = PhaselineSettings.load(config);
        if (noDaemon) {
            WarmBundle bundle = new WarmBundle(config, settings, 0).initialize();
            try {
                return bundle.withLock(() -> DISPATCHER.dispatch(bundle, method, params));
            } finally {
                bundle.close();
            }
        }
        try (DaemonClient client = new DaemonClient(config, settings)) {
            return client.call(method, params);
        }
    }

    static ObjectNode params() {
        return Jsons.mapper().createObjectNode();
    }

    static int print(Object value) {
        System.out.println(Jsons.toJson(value));
        return 0;
    }

    /**
     * JSON when it parses, otherwise the raw text with a warning.
     */
    static JsonNode parseOutput(String raw, String origin) {
        try {
            JsonNode node = Jsons.mapper().readTree(raw);
            if (node != null && !node.isMissingNode()) {
                return node;
            }
        } catch (JsonProcessingException e) {
            log.warn("Output from {} is not valid JSON, storing it as text", origin);
        }
        return TextNode.valueOf(raw);
    }

    @Command(name = "init", description = "Start a new pipeline session")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Parameters(arity = "1..*", description = "Research query")
        List<String> query;

        @Option(names = {"--mode"}, description = "Data source mode: local | hybrid | external", defaultValue = "external")
        String mode;

        @Override
        public Integer call() {
            ObjectNode p = params();
            p.put("query", String.join(" ", query));
            p.put("mode", mode);
            return print(parent.invoke("init", p));
        }
    }

    @Command(name = "next", description = "Show the current step to execute")
    static final class NextCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            ObjectNode p = params();
            p.put("sessionId", sessionId);
            return print(parent.invoke("next", p));
        }
    }

    @Command(name = "complete", description = "Mark the current step complete and advance")
    static final class CompleteCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Parameters(index = "1", description = "Key of the step that was executed")
        String stepKey;

        @Option(names = {"--result"}, description = "Step output as JSON")
        String result;

        @Option(names = {"--file"}, description = "Read step output from a file")
        Path file;

        @Override
        public Integer call() throws IOException {
            if (result != null && file != null) {
                throw new IllegalArgumentException("Use either --result or --file, not both");
            }
            ObjectNode p = params();
            p.put("sessionId", sessionId);
            p.put("stepKey", stepKey);
            if (result != null) {
                p.set("output", parseOutput(result, "--result"));
            } else if (file != null) {
                p.set("output", parseOutput(Files.readString(file, StandardCharsets.UTF_8), file.toString()));
            }
            return print(parent.invoke("complete", p));
        }
    }

    @Command(name = "status", description = "Show session progress")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            ObjectNode p = params();
            p.put("sessionId", sessionId);
            return print(parent.invoke("status", p));
        }
    }

    @Command(name = "list", description = "List recent sessions")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Option(names = {"--all"}, description = "Include sessions up to a year old")
        boolean all;

        @Override
        public Integer call() {
            ObjectNode p = params();
            p.put("all", all);
            return print(parent.invoke("list", p));
        }
    }

    @Command(name = "resume", description = "Show the current step of an interrupted session")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            ObjectNode p = params();
            p.put("sessionId", sessionId);
            return print(parent.invoke("resume", p));
        }
    }

    @Command(name = "abort", description = "Abort a session")
    static final class AbortCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            ObjectNode p = params();
            p.put("sessionId", sessionId);
            return print(parent.invoke("abort", p));
        }
    }

    @Command(name = "checkpoints", description = "List checkpoints of a session")
    static final class CheckpointsCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Override
        public Integer call() {
            ObjectNode p = params();
            p.put("sessionId", sessionId);
            return print(parent.invoke("checkpoints", p));
        }
    }

    @Command(name = "rollback", description = "Restore a checkpoint and move the session back to it")
    static final class RollbackCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Option(names = {"--checkpoint"}, description = "Checkpoint id (default: latest)")
        String checkpointId;

        @Override
        public Integer call() {
            ObjectNode p = params();
            p.put("sessionId", sessionId);
            if (checkpointId != null) {
                p.put("checkpointId", checkpointId);
            }
            JsonNode out = parent.invoke("rollback", p);
            print(out);
            return out.path("rolledBack").asBoolean(false) ? 0 : 1;
        }
    }

    @Command(name = "purge", description = "Delete expired sessions")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Option(names = {"--older-than-days"}, defaultValue = "0",
                description = "Only delete expired sessions inactive for at least this many days")
        int olderThanDays;

        @Override
        public Integer call() {
            ObjectNode p = params();
            p.put("olderThanDays", olderThanDays);
            return print(parent.invoke("purge", p));
        }
    }

    @Command(name = "tool-usage", description = "Record an external tool use and check whether it is allowed")
    static final class ToolUsageCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Parameters(index = "1", description = "Step key")
        String stepKey;

        @Parameters(index = "2", description = "Tool name: webSearch | webFetch | perplexity")
        String tool;

        @Option(names = {"--justification"}, defaultValue = "", description = "Why the tool is needed")
        String justification;

        @Override
        public Integer call() {
            ObjectNode p = params();
            p.put("sessionId", sessionId);
            p.put("stepKey", stepKey);
            p.put("tool", tool);
            p.put("justification", justification);
            JsonNode out = parent.invoke("toolUsage", p);
            print(out);
            return out.path("allowed").asBoolean(false) ? 0 : 3;
        }
    }

    @Command(name = "coverage", description = "Set the local corpus coverage grade of a session")
    static final class CoverageCommand implements Callable<Integer> {
        @ParentCommand
        PhaselineCommand parent;

        @Parameters(index = "0", description = "Session id")
        String sessionId;

        @Parameters(index = "1", description = "NONE | LOW | MED | HIGH")
        String grade;

        @Override
        public Integer call() {
            ObjectNode p = params();
            p.put("sessionId", sessionId);
            p.put("grade", grade);
            return print(parent.invoke("coverage", p));
        }
    }

    @Command(
            name = "daemon",
            description = "Manage the warm daemon",
            subcommands = {
                    DaemonServeCommand.class,
                    DaemonStartCommand.class,
                    DaemonStopCommand.class,
                    DaemonHealthCommand.class,
                    DaemonRestartCommand.class
            }
    )
    static final class DaemonCommand implements Runnable {
        @ParentCommand
        PhaselineCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: serve | start | stop | health | restart");
        }

        DaemonClient client(boolean autoStart) {
            PhaselineConfig config = parent.config();
            PhaselineSettings settings = PhaselineSettings.load(config).withDaemonAutoStart(autoStart);
            return new DaemonClient(config, settings);
        }
    }

    @Command(name = "serve", description = "Run the daemon in the foreground")
    static final class DaemonServeCommand implements Callable<Integer> {
        @ParentCommand
        DaemonCommand daemon;

        @Override
        public Integer call() throws Exception {
            PhaselineConfig config = daemon.parent.config();
            DaemonServer server = new DaemonServer(config, PhaselineSettings.load(config));
            server.start();
            Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "phaseline-shutdown"));
            print(server.health());
            server.awaitStop();
            return 0;
        }
    }

    @Command(name = "start", description = "Start the daemon in the background if it is not running")
    static final class DaemonStartCommand implements Callable<Integer> {
        @ParentCommand
        DaemonCommand daemon;

        @Override
        public Integer call() {
            try (DaemonClient client = daemon.client(true)) {
                return print(client.ensureRunning());
            }
        }
    }

    @Command(name = "stop", description = "Ask the running daemon to shut down")
    static final class DaemonStopCommand implements Callable<Integer> {
        @ParentCommand
        DaemonCommand daemon;

        @Override
        public Integer call() {
            try (DaemonClient client = daemon.client(false)) {
                return print(client.call("shutdown", params()));
            }
        }
    }

    @Command(name = "health", description = "Show daemon health and request statistics")
    static final class DaemonHealthCommand implements Callable<Integer> {
        @ParentCommand
        DaemonCommand daemon;

        @Override
        public Integer call() {
            try (DaemonClient client = daemon.client(false)) {
                JsonNode out = client.call("health", params());
                print(out);
                return out.path("ok").asBoolean(false) ? 0 : 1;
            }
        }
    }

    @Command(name = "restart", description = "Rebuild the daemon's warm bundle in place")
    static final class DaemonRestartCommand implements Callable<Integer> {
        @ParentCommand
        DaemonCommand daemon;

        @Override
        public Integer call() {
            try (DaemonClient client = daemon.client(false)) {
                return print(client.call("restart", params()));
            }
        }
    }
}
