package ae.teletronics.uploadguard.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Outcome of one scan. {@code safe} holds exactly when {@code findings} is empty.
 *
 * <p>Findings keep insertion order and are distinct by message; flags and details
 * carry facts that are not threats on their own.</p>
 */
public record ScanResult(String scanner,
                         boolean safe,
                         List<Finding> findings,
                         Set<ScanFlag> flags,
                         Map<String, String> details) {

    public ScanResult {
        Objects.requireNonNull(scanner, "scanner");
        findings = List.copyOf(findings);
        flags = flags.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ScanFlag.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        if (safe != findings.isEmpty()) {
            throw new IllegalArgumentException("safe must be true iff there are no findings");
        }
    }

    public static ScanResult rejected(String scanner, ThreatType type, String reason) {
        return builder(scanner).finding(type, reason).build();
    }

    public static Builder builder(String scanner) {
        return new Builder(scanner);
    }

    public List<String> threats() {
        return findings.stream().map(Finding::message).toList();
    }

    public boolean hasFlag(ScanFlag flag) {
        return flags.contains(flag);
    }

    public static final class Builder {
        private final String scanner;
        private final Map<String, Finding> findings = new LinkedHashMap<>();
        private final Set<ScanFlag> flags = EnumSet.noneOf(ScanFlag.class);
        private final Map<String, String> details = new LinkedHashMap<>();

        private Builder(String scanner) {
            this.scanner = scanner;
        }

        public Builder finding(ThreatType type, String message) {
            return finding(new Finding(type, message));
        }

        public Builder finding(Finding finding) {
            findings.putIfAbsent(finding.message(), finding);
            return this;
        }

        public Builder flag(ScanFlag flag) {
            flags.add(flag);
            return this;
        }

        public Builder detail(String key, Object value) {
            if (value != null) {
                details.put(key, String.valueOf(value));
            }
            return this;
        }

        /** Folds another result in: findings appended in order, flags unioned, details added. */
        public Builder merge(ScanResult other) {
            other.findings().forEach(this::finding);
            flags.addAll(other.flags());
            other.details().forEach(details::putIfAbsent);
            return this;
        }

        /** Like {@link #merge} but every finding message is prefixed, e.g. with a nested entry name. */
        public Builder mergePrefixed(ScanResult other, String prefix) {
            other.findings().forEach(f -> finding(f.prefixed(prefix)));
            flags.addAll(other.flags());
            return this;
        }

        public boolean hasFindings() {
            return !findings.isEmpty();
        }

        public ScanResult build() {
            List<Finding> ordered = new ArrayList<>(findings.values());
            return new ScanResult(scanner, ordered.isEmpty(), ordered, new LinkedHashSet<>(flags), details);
        }
    }
}
