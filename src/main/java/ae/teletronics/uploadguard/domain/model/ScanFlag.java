package ae.teletronics.uploadguard.domain.model;

/**
 * Non-threat facts a scan may establish. A flag on its own never makes a file unsafe.
 */
public enum ScanFlag {
    HAS_JAVASCRIPT,
    HAS_EXTERNAL_REFERENCE,
    HAS_GPS,
    HAS_MACROS,
    HAS_LEGACY_CONTROLS,
    HAS_ENTITY_DECLARATION,
    NESTED_ARCHIVE,
    BINARY_SKIPPED,
    BACKEND_UNAVAILABLE,
    METADATA_STRIPPED
}
