package ae.teletronics.uploadguard.application.scanning;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.domain.model.AccessDecision;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.model.ThreatType;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import org.slf4j.Logger;

import java.io.IOException;

/**
 * Access check plus failure containment shared by all scanners. Anything escaping the body, including
 * running out of memory on a hostile input, becomes an unsafe result rather than an exception.
 */
public final class ScanBoundary {
    private ScanBoundary() {}

    @FunctionalInterface
    public interface Body {
        ScanResult run() throws IOException;
    }

    public static ScanResult guard(String scanner,
                                   ThreatType failureType,
                                   ScanTarget target,
                                   ScanPolicy policy,
                                   AccessValidator access,
                                   Logger log,
                                   Body body) {
        AccessDecision decision = access.validate(target.path(), policy.access());
        if (!decision.allowed()) {
            log.debug("{} refused {}: {}", scanner, target.path(), decision.reason());
            return decision.toResult(scanner);
        }
        try {
            return body.run();
        } catch (IOException | RuntimeException e) {
            log.warn("{} failed on {}: {}", scanner, target.declaredName(), e.toString());
            return failed(scanner, failureType, e);
        } catch (OutOfMemoryError e) {
            log.error("{} ran out of memory on {}", scanner, target.declaredName());
            return failed(scanner, failureType, e);
        }
    }

    public static ScanResult failed(String scanner, ThreatType type, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return ScanResult.rejected(scanner, type, "Scan failed: " + reason);
    }
}
