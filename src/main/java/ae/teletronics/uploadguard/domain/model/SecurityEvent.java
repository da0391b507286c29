package ae.teletronics.uploadguard.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One security-relevant observation about a scanned file, handed to a {@link ae.teletronics.uploadguard.ports.SecurityEventSink}.
 *
 * @param context file summary (name, size, sha256, detected type) and the full finding list
 */
public record SecurityEvent(ThreatType type, Severity severity, String message, Map<String, Object> context) {

    public SecurityEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
        severity = severity == null ? type.defaultSeverity() : severity;
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static SecurityEvent of(Finding finding, Map<String, Object> context) {
        return new SecurityEvent(finding.type(), finding.type().defaultSeverity(), finding.message(), context);
    }
}
