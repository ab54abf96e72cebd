package com.name.suggestion.diagnostic;

/**
 * The kinds of unresolved names a suggestion can be produced for.
 * Each category carries the minimum composite score its suggestions must reach.
 */
public enum DiagnosticCategory {
    MEMBER_NOT_FOUND("SMB001", "member.not.found", 0.3),
    VARIABLE_NOT_FOUND("SMB002", "variable.not.found", 0.3),
    NAMESPACE_NOT_FOUND("SMB003", "namespace.not.found", 0.7),
    NAMED_ARGUMENT_NOT_FOUND("SMB004", "named.argument.not.found", 0.3),
    INVALID_NAMEOF_ARGUMENT("SMB005", "invalid.nameof.argument", 0.3);

    private final String id;
    private final String messageKeyPrefix;
    private final double minimumScore;

    DiagnosticCategory(String id, String messageKeyPrefix, double minimumScore) {
        this.id = id;
        this.messageKeyPrefix = messageKeyPrefix;
        this.minimumScore = minimumScore;
    }

    public String id() {
        return id;
    }

    public String messageKeyPrefix() {
        return messageKeyPrefix;
    }

    public double minimumScore() {
        return minimumScore;
    }
}
