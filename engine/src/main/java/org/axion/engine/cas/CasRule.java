package org.axion.engine.cas;

import java.util.Locale;

/**
 * Rewrite rules understood by {@link RewriteEngine}.
 */
public enum CasRule {
    DIFFERENTIATE("differentiate"),
    INTEGRATE("integrate"),
    SIMPLIFY("simplify");

    private final String ruleName;

    CasRule(String ruleName) {
        this.ruleName = ruleName;
    }

    public String ruleName() {
        return ruleName;
    }

    /**
     * Resolves a rule by its name, ignoring case.
     *
     * @throws IllegalArgumentException if no rule has that name
     */
    public static CasRule fromName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (CasRule rule : values()) {
            if (rule.ruleName.equals(normalized)) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Unknown rewrite rule: " + name);
    }
}
