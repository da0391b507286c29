package ae.teletronics.uploadguard.domain.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * A file on disk plus the name the uploader claimed for it. The declared name only
 * feeds extension checks; content is always read from {@code path}.
 */
public record ScanTarget(Path path, String declaredName) {

    public ScanTarget {
        Objects.requireNonNull(path, "path");
        if (declaredName == null || declaredName.isBlank()) {
            Path fn = path.getFileName();
            declaredName = fn == null ? "" : fn.toString();
        }
    }

    public static ScanTarget of(Path path) {
        return new ScanTarget(path, null);
    }

    /** Lower-case extension of the declared name without the dot, or "" when there is none. */
    public String extension() {
        return extensionOf(declaredName);
    }

    public static String extensionOf(String name) {
        if (name == null) return "";
        String base = name.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        int dot = base.lastIndexOf('.');
        if (dot < 0 || dot == base.length() - 1) return "";
        return base.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
