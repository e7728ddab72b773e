package com.atelier.project.validation;

/**
 * Outcome of a payload validation.
 *
 * @param ok whether the payload may be replicated
 * @param reason human-readable rejection reason, {@code null} when ok
 * @param path location of the offending value, {@code null} when ok
 */
public record ValidationResult(boolean ok, String reason, String path) {

    private static final ValidationResult OK = new ValidationResult(true, null, null);

    public static ValidationResult accepted() {
        return OK;
    }

    public static ValidationResult rejected(String reason, String path) {
        return new ValidationResult(false, reason, path);
    }

    public boolean isRejected() {
        return !ok;
    }
}
