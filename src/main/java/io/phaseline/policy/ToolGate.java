package io.phaseline.policy;

import io.phaseline.model.CoverageGrade;
import io.phaseline.model.DataSourceMode;
import io.phaseline.model.QueryIntent;
import io.phaseline.model.ToolPermissions;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides which external research tools a session may use, from its data-source mode, the
 * local corpus coverage and what the query asks for.
 */
public final class ToolGate {
    private static final List<String> RECENCY_MARKERS = List.of(
            "latest", "recent", "current", "new", "modern", "contemporary",
            "2024", "2025", "2026", "today", "now", "emerging", "cutting-edge",
            "state-of-the-art", "up-to-date", "breakthrough", "novel"
    );
    private static final List<String> OUTSIDE_CORPUS_INDICATORS = List.of(
            "cryptocurrency", "blockchain", "NFT", "metaverse", "web3",
            "GPT-4", "GPT-5", "Claude 3", "Gemini", "LLaMA", "Mistral",
            "SORA", "Devin", "o1", "o3", "DeepSeek",
            "quantum computing", "fusion energy",
            "SpaceX", "Starship", "Neuralink",
            "CRISPR", "AlphaFold", "mRNA vaccine"
    );
    private static final Pattern YEAR = Pattern.compile("\\b(20[2-9][0-9])\\b");

    private ToolGate() {
    }

    public static ToolPermissions resolvePermissions(DataSourceMode mode, CoverageGrade coverage, QueryIntent intent) {
        DataSourceMode effective = mode == null ? DataSourceMode.EXTERNAL : mode;
        switch (effective) {
            case LOCAL:
                return ToolPermissions.none();
            case EXTERNAL:
                return ToolPermissions.all();
            default:
                break;
        }
        if (coverage == null || coverage == CoverageGrade.NONE || coverage == CoverageGrade.LOW) {
            return ToolPermissions.all();
        }
        if (intent != null && (intent.recencyRequired()
                || !intent.outsideCorpusDomains().isEmpty()
                || intent.externalSupplementationJustified())) {
            return ToolPermissions.all();
        }
        return ToolPermissions.none();
    }

    public static QueryIntent analyzeQueryIntent(String query) {
        String lower = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<String> temporal = new ArrayList<>();
        for (String marker : RECENCY_MARKERS) {
            if (containsWord(lower, marker)) {
                temporal.add(marker);
            }
        }
        List<String> domains = new ArrayList<>();
        for (String domain : OUTSIDE_CORPUS_INDICATORS) {
            if (containsWord(lower, domain)) {
                domains.add(domain);
            }
        }
        boolean recency = !temporal.isEmpty() || YEAR.matcher(lower).find();
        boolean justified = recency
                || !domains.isEmpty()
                || (containsWord(lower, "comparison") && containsWord(lower, "current"));
        return new QueryIntent(recency, domains, justified, temporal);
    }

    // Whole-word match so that "now" does not fire on "knowledge".
    static boolean containsWord(String haystackLower, String needle) {
        String n = needle.toLowerCase(Locale.ROOT);
        int from = 0;
        while (true) {
            int at = haystackLower.indexOf(n, from);
            if (at < 0) {
                return false;
            }
            int end = at + n.length();
            boolean leftOk = at == 0 || !Character.isLetterOrDigit(haystackLower.charAt(at - 1));
            boolean rightOk = end == haystackLower.length() || !Character.isLetterOrDigit(haystackLower.charAt(end));
            if (leftOk && rightOk) {
                return true;
            }
            from = at + 1;
        }
    }
}
