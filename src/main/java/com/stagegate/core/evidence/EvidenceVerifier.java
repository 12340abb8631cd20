package com.stagegate.core.evidence;

import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.model.Evidence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Confirms that an evidence artifact exists, contains the success criteria and
 * carries none of the failure markers.
 * <p>
 * Matching is case-insensitive substring search. An optional maximum age rejects
 * artifacts older than the configured limit.
 */
@Component
public class EvidenceVerifier {

    private static final Logger log = LoggerFactory.getLogger(EvidenceVerifier.class);

    private final List<String> failureMarkers;
    private final Duration maxAge;
    private final Clock clock;

    @Autowired
    public EvidenceVerifier(StageGateProperties properties) {
        this(properties.getEvidence().getFailureMarkers(), properties.getEvidence().getMaxAge(), Clock.systemUTC());
    }

    public EvidenceVerifier(List<String> failureMarkers, Duration maxAge, Clock clock) {
        this.failureMarkers = failureMarkers.stream()
                .filter(m -> m != null && !m.isBlank())
                .map(m -> m.toLowerCase(Locale.ROOT))
                .toList();
        this.maxAge = maxAge == null ? Duration.ZERO : maxAge;
        this.clock = clock;
    }

    /**
     * @param evidence        the claim to check
     * @param successCriteria text the artifact must contain; the owning task's criteria,
     *                        or the claim itself when the evidence has no owning task
     */
    public VerificationResult verify(Evidence evidence, String successCriteria) {
        String location = evidence.location();
        if (location == null || location.isBlank()) {
            return VerificationResult.failed(VerificationFailure.MISSING_FILE,
                    "Evidence " + evidence.id() + " has no location");
        }

        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            log.debug("Evidence {} missing at {}", evidence.id(), location);
            return VerificationResult.failed(VerificationFailure.MISSING_FILE, "Evidence file missing: " + location);
        }

        byte[] bytes;
        try {
            if (!maxAge.isZero() && !maxAge.isNegative()) {
                Instant modified = Files.getLastModifiedTime(path).toInstant();
                Duration age = Duration.between(modified, clock.instant());
                if (age.compareTo(maxAge) > 0) {
                    return VerificationResult.failed(VerificationFailure.STALE_ARTIFACT,
                            String.format("Evidence is stale: %ds old (max: %ds): %s",
                                    age.toSeconds(), maxAge.toSeconds(), location));
                }
            }
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            log.warn("Cannot read evidence {} at {}: {}", evidence.id(), location, e.getMessage());
            return VerificationResult.failed(VerificationFailure.UNREADABLE_FILE,
                    "Cannot read evidence file " + location + ": " + e.getMessage());
        }

        String digest = sha256(bytes);
        String content = new String(bytes, StandardCharsets.UTF_8).toLowerCase(Locale.ROOT);

        if (successCriteria == null || successCriteria.isBlank()) {
            return VerificationResult.failed(VerificationFailure.CRITERIA_NOT_FOUND,
                    "No success criteria to look for in " + location, digest);
        }
        if (!content.contains(successCriteria.toLowerCase(Locale.ROOT))) {
            return VerificationResult.failed(VerificationFailure.CRITERIA_NOT_FOUND,
                    String.format("'%s' not found in %s", successCriteria, location), digest);
        }
        for (String marker : failureMarkers) {
            if (content.contains(marker)) {
                return VerificationResult.failed(VerificationFailure.FAILURE_MARKER_PRESENT,
                        String.format("Failure marker '%s' present in %s", marker, location), digest);
            }
        }
        return VerificationResult.proven("Evidence confirms '" + successCriteria + "'", digest);
    }

    private static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
