package ae.teletronics.uploadguard.domain.policy;

import java.util.List;

import static ae.teletronics.uploadguard.domain.policy.CodePolicy.copy;

/**
 * @param scannedFields metadata keywords whose text is checked; empty means the built-in list
 */
public record MetadataPolicy(boolean enabled,
                             boolean checkGps,
                             boolean blockGps,
                             boolean stripMetadata,
                             int trailingBytesThreshold,
                             List<String> scannedFields) {

    public static final int DEFAULT_TRAILING_BYTES_THRESHOLD = 100;

    public MetadataPolicy {
        if (trailingBytesThreshold < 0) throw new IllegalArgumentException("trailingBytesThreshold must be >= 0");
        scannedFields = copy(scannedFields);
    }

    public static MetadataPolicy defaults() {
        return new MetadataPolicy(true, true, false, false, DEFAULT_TRAILING_BYTES_THRESHOLD, List.of());
    }

    public MetadataPolicy withGps(boolean check, boolean block) {
        return new MetadataPolicy(enabled, check, block, stripMetadata, trailingBytesThreshold, scannedFields);
    }

    public MetadataPolicy withStripMetadata(boolean strip) {
        return new MetadataPolicy(enabled, checkGps, blockGps, strip, trailingBytesThreshold, scannedFields);
    }
}
