package ae.teletronics.uploadguard.domain.policy;

import java.nio.file.Path;
import java.util.List;

/**
 * @param checkSymlinks reject targets that are symbolic links
 * @param allowedRoots  directories a target must resolve into; empty means the environment defaults
 */
public record AccessPolicy(boolean checkSymlinks, List<Path> allowedRoots) {

    public AccessPolicy {
        allowedRoots = allowedRoots == null ? List.of() : List.copyOf(allowedRoots);
    }

    public static AccessPolicy defaults() {
        return new AccessPolicy(true, List.of());
    }

    public AccessPolicy withAllowedRoots(List<Path> roots) {
        return new AccessPolicy(checkSymlinks, roots);
    }

    public AccessPolicy withCheckSymlinks(boolean check) {
        return new AccessPolicy(check, allowedRoots);
    }
}
