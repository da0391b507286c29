package ae.teletronics.uploadguard.adapters.logging;

import ae.teletronics.uploadguard.domain.model.SecurityEvent;
import ae.teletronics.uploadguard.ports.SecurityEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes security events to the {@code uploadguard.security} logger. CRITICAL and HIGH go out as ERROR,
 * MEDIUM as WARN and LOW as INFO.
 */
public class Slf4jSecurityEventSink implements SecurityEventSink {

    public static final String LOGGER_NAME = "uploadguard.security";

    private final Logger log;
    private final boolean enabled;
    private final boolean detailed;

    public Slf4jSecurityEventSink(boolean enabled, boolean detailed) {
        this(LoggerFactory.getLogger(LOGGER_NAME), enabled, detailed);
    }

    Slf4jSecurityEventSink(Logger log, boolean enabled, boolean detailed) {
        this.log = log;
        this.enabled = enabled;
        this.detailed = detailed;
    }

    @Override
    public void record(SecurityEvent event) {
        if (!enabled) return;
        String type = event.type().tag();
        switch (event.severity()) {
            case CRITICAL, HIGH -> {
                if (detailed) log.error("[{}] {} {}", type, event.message(), event.context());
                else log.error("[{}] {}", type, event.message());
            }
            case MEDIUM -> {
                if (detailed) log.warn("[{}] {} {}", type, event.message(), event.context());
                else log.warn("[{}] {}", type, event.message());
            }
            case LOW -> {
                if (detailed) log.info("[{}] {} {}", type, event.message(), event.context());
                else log.info("[{}] {}", type, event.message());
            }
        }
    }
}
