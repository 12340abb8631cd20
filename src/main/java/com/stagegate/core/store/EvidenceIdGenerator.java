package com.stagegate.core.store;

import com.stagegate.core.model.Stage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Issues evidence ids of the form {@code E-<STAGE>-<SESSION>-<SEQ>}, one sequence per stage.
 */
public class EvidenceIdGenerator {

    private static final Pattern ID = Pattern.compile("^E-([A-Z]+)-[\\w.]+-(\\d{3})$");

    private final String session;
    private final Map<String, AtomicInteger> sequences = new ConcurrentHashMap<>();

    public EvidenceIdGenerator(String runId) {
        this.session = sessionOf(runId);
    }

    /**
     * The random suffix of a {@code yyyyMMdd_HHmmss_<hex>} run id, so runs started on the
     * same day never share a session. Other ids are used whole, minus characters the id
     * pattern does not allow.
     */
    static String sessionOf(String runId) {
        String tail = runId.substring(runId.lastIndexOf('_') + 1);
        String session = tail.replaceAll("[^\\w.]", "");
        return session.isEmpty() ? "run" : session;
    }

    public String next(Stage stage) {
        int seq = sequences.computeIfAbsent(stage.gateName(), k -> new AtomicInteger()).incrementAndGet();
        return String.format("E-%s-%s-%03d", stage.gateName(), session, seq);
    }

    /**
     * Advances the sequence past an id issued earlier, so resumed runs never reuse one.
     */
    public void observe(String evidenceId) {
        Matcher m = ID.matcher(evidenceId);
        if (m.matches()) {
            int seq = Integer.parseInt(m.group(2));
            sequences.computeIfAbsent(m.group(1), k -> new AtomicInteger())
                    .accumulateAndGet(seq, Math::max);
        }
    }
}
