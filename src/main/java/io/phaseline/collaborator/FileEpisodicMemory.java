package io.phaseline.collaborator;

import com.fasterxml.jackson.databind.JsonNode;
import io.phaseline.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSONL episode log. Injection appends the most recent episodes recorded for the same step
 * key by other sessions.
 */
public final class FileEpisodicMemory implements EpisodicMemory {
    static final int EXCERPT_CHARS = 280;

    private final Path file;

    public FileEpisodicMemory(Path file) {
        this.file = file;
    }

    @Override
    public InjectionResult inject(String prompt, InjectionOptions options) {
        if (options.window() <= 0 || !Files.isRegularFile(file)) {
            return InjectionResult.unchanged(prompt);
        }
        List<Episode> matches = new ArrayList<>();
        for (String line : readLines()) {
            if (line.isBlank()) {
                continue;
            }
            Episode episode = parse(line);
            if (episode != null
                    && options.stepKey().equals(episode.stepKey())
                    && !options.sessionId().equals(episode.sessionId())) {
                matches.add(episode);
            }
        }
        if (matches.isEmpty()) {
            return InjectionResult.unchanged(prompt);
        }
        List<Episode> recent = matches.subList(Math.max(0, matches.size() - options.window()), matches.size());
        StringBuilder sb = new StringBuilder(prompt);
        sb.append("\n## RELATED PAST EPISODES\n");
        for (Episode episode : recent) {
            sb.append("- [").append(episode.query()).append("] quality=")
                    .append(String.format("%.2f", episode.quality()))
                    .append(": ").append(episode.excerpt()).append('\n');
        }
        return new InjectionResult(sb.toString(), recent.size());
    }

    @Override
    public synchronized void store(Episode episode) {
        String excerpt = episode.excerpt() == null ? "" : episode.excerpt();
        if (excerpt.length() > EXCERPT_CHARS) {
            excerpt = excerpt.substring(0, EXCERPT_CHARS);
        }
        Episode trimmed = new Episode(episode.timestamp(), episode.sessionId(), episode.stepKey(),
                episode.query(), episode.quality(), excerpt.replace('\n', ' '));
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, Jsons.toCompactJson(trimmed) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to store episode", e);
        }
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read episodes: " + file, e);
        }
    }

    private static Episode parse(String line) {
        try {
            JsonNode node = Jsons.mapper().readTree(line);
            return Jsons.mapper().treeToValue(node, Episode.class);
        } catch (IOException e) {
            // A torn trailing line from a concurrent append.
            return null;
        }
    }
}
