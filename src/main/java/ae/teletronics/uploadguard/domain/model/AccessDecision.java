package ae.teletronics.uploadguard.domain.model;

public record AccessDecision(boolean allowed, Denial denial) {

    public enum Denial {
        SYMLINK("Symbolic link detected"),
        NULL_BYTE("Invalid path: null byte detected"),
        UNRESOLVED("Unable to resolve file path"),
        OUTSIDE_ALLOWED_ROOTS("File path outside allowed directories");

        private final String message;

        Denial(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private static final AccessDecision ALLOWED = new AccessDecision(true, null);

    public static AccessDecision allow() {
        return ALLOWED;
    }

    public static AccessDecision deny(Denial denial) {
        return new AccessDecision(false, denial);
    }

    public String reason() {
        return denial == null ? null : denial.message();
    }

    /** Converts a denial into the single-finding result every scanner returns for it. */
    public ScanResult toResult(String scanner) {
        ThreatType type = denial == Denial.SYMLINK ? ThreatType.SYMLINK_DETECTED : ThreatType.DANGEROUS_FILE;
        return ScanResult.rejected(scanner, type, reason());
    }
}
