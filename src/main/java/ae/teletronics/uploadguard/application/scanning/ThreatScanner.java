package ae.teletronics.uploadguard.application.scanning;

import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;

/**
 * A pattern-based scanner for one threat family. Implementations never throw; every fault ends up as a
 * finding in the returned result.
 */
public interface ThreatScanner {

    String name();

    ScanResult scan(ScanTarget target, ScanPolicy policy);
}
