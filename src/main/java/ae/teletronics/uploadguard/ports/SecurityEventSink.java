package ae.teletronics.uploadguard.ports;

import ae.teletronics.uploadguard.domain.model.SecurityEvent;

/**
 * Destination for security events raised while scanning. Implementations must not throw.
 */
public interface SecurityEventSink {

    void record(SecurityEvent event);
}
