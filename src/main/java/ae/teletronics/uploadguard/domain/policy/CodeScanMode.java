package ae.teletronics.uploadguard.domain.policy;

public enum CodeScanMode {
    /** Built-in dangerous functions plus configured additions. */
    DEFAULT,
    /** Only the small set of direct execution primitives. */
    STRICT,
    /** Only the configured functions. */
    CUSTOM
}
