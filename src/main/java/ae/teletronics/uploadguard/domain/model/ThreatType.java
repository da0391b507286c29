package ae.teletronics.uploadguard.domain.model;

import java.util.Locale;

/**
 * Fixed taxonomy used to tag findings and security events.
 */
public enum ThreatType {
    MIME_MISMATCH(Severity.MEDIUM),
    DANGEROUS_FILE(Severity.HIGH),
    CODE_INJECTION(Severity.CRITICAL),
    MARKUP_INJECTION(Severity.HIGH),
    METADATA_THREAT(Severity.HIGH),
    DOCUMENT_THREAT(Severity.HIGH),
    GPS_DETECTED(Severity.LOW),
    ENTITY_ATTACK(Severity.CRITICAL),
    ARCHIVE_THREAT(Severity.HIGH),
    MACRO_DETECTED(Severity.HIGH),
    SYMLINK_DETECTED(Severity.CRITICAL),
    DECOMPRESSION_BOMB(Severity.CRITICAL);

    private final Severity defaultSeverity;

    ThreatType(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    /** Lower-case tag used in log lines, e.g. "decompression_bomb". */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
