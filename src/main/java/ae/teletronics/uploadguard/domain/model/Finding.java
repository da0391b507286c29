package ae.teletronics.uploadguard.domain.model;

import java.util.Objects;

/**
 * One human-readable finding together with the category it is reported under.
 */
public record Finding(ThreatType type, String message) {

    public Finding {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
    }

    public Finding prefixed(String prefix) {
        return new Finding(type, prefix + message);
    }
}
