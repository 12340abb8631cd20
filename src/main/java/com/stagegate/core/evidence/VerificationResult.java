package com.stagegate.core.evidence;

/**
 * @param proven  whether the artifact substantiates the claim
 * @param reason  failure reason, {@code null} when proven
 * @param detail  human-readable explanation
 * @param sha256  digest of the artifact content, {@code null} if it could not be read
 */
public record VerificationResult(
    boolean proven,
    VerificationFailure reason,
    String detail,
    String sha256
) {

    public static VerificationResult proven(String detail, String sha256) {
        return new VerificationResult(true, null, detail, sha256);
    }

    public static VerificationResult failed(VerificationFailure reason, String detail) {
        return new VerificationResult(false, reason, detail, null);
    }

    public static VerificationResult failed(VerificationFailure reason, String detail, String sha256) {
        return new VerificationResult(false, reason, detail, sha256);
    }
}
