package ae.teletronics.uploadguard.domain.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * @param customSignatures hex prefix to media type, walked in insertion order before the built-ins
 */
public record DetectionPolicy(boolean blockDangerousTypes,
                              boolean strictExtensionMatching,
                              Set<String> dangerousTypes,
                              Map<String, String> customSignatures) {

    public static final Set<String> DEFAULT_DANGEROUS_TYPES = Set.of(
            "application/x-msdownload",
            "application/x-dosexec",
            "application/x-executable",
            "application/x-mach-binary",
            "application/x-php",
            "text/x-php",
            "application/x-httpd-php",
            "text/x-shellscript",
            "application/x-sh",
            "text/x-jsp",
            "application/java-archive");

    public DetectionPolicy {
        dangerousTypes = dangerousTypes == null ? DEFAULT_DANGEROUS_TYPES : Set.copyOf(dangerousTypes);
        customSignatures = customSignatures == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(customSignatures));
    }

    public static DetectionPolicy defaults() {
        return new DetectionPolicy(true, true, DEFAULT_DANGEROUS_TYPES, Map.of());
    }

    public DetectionPolicy withCustomSignatures(Map<String, String> signatures) {
        return new DetectionPolicy(blockDangerousTypes, strictExtensionMatching, dangerousTypes, signatures);
    }

    public DetectionPolicy withStrictExtensionMatching(boolean strict) {
        return new DetectionPolicy(blockDangerousTypes, strict, dangerousTypes, customSignatures);
    }
}
