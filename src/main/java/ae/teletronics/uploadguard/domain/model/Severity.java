package ae.teletronics.uploadguard.domain.model;

public enum Severity {
    LOW, MEDIUM, HIGH, CRITICAL
}
