package work.blocks.ast.api;

/**
 * Log level used when reporting construction diagnostics.
 */
public enum DiagnosticLevel {
    OFF,
    DEBUG,
    INFO,
    WARN;

    /** Level reported when a manifest leaves {@code diagnostics.level} unset. */
    public static final DiagnosticLevel DEFAULT = WARN;

    /**
     * Parses a {@code diagnostics.level} value; {@code null} or blank selects {@link #DEFAULT}.
     */
    public static DiagnosticLevel from(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        String wanted = value.trim();
        for (DiagnosticLevel level : values()) {
            if (level.name().equalsIgnoreCase(wanted)) {
                return level;
            }
        }
        throw new IllegalArgumentException(
            "Unknown diagnostics level \"" + wanted + "\" (expected off, debug, info or warn)"
        );
    }
}
