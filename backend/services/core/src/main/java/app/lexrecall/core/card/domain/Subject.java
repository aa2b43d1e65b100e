package app.lexrecall.core.card.domain;

import app.lexrecall.core.common.error.ValidationException;

import java.util.Locale;

public enum Subject {
    CONTRACTS("contracts"),
    TORTS("torts"),
    CONSTITUTIONAL_LAW("constitutional_law"),
    CRIMINAL_LAW("criminal_law"),
    CRIMINAL_PROCEDURE("criminal_procedure"),
    CIVIL_PROCEDURE("civil_procedure"),
    EVIDENCE("evidence"),
    REAL_PROPERTY("real_property"),
    PROFESSIONAL_RESPONSIBILITY("professional_responsibility"),
    CORPORATIONS("corporations"),
    WILLS_TRUSTS_ESTATES("wills_trusts_estates"),
    FAMILY_LAW("family_law"),
    SECURED_TRANSACTIONS("secured_transactions"),
    IOWA_PROCEDURE("iowa_procedure");

    private final String code;

    Subject(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Accepts either the wire code ({@code real_property}) or the constant name, ignoring case.
     * Anything else is rejected rather than coerced.
     */
    public static Subject fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("subject", "Subject is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Subject s : values()) {
            if (s.code.equals(normalized) || s.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return s;
            }
        }
        throw new ValidationException("subject", "Unknown subject: " + value);
    }
}
