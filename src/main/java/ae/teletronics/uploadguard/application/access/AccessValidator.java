package ae.teletronics.uploadguard.application.access;

import ae.teletronics.uploadguard.domain.model.AccessDecision;
import ae.teletronics.uploadguard.domain.model.AccessDecision.Denial;
import ae.teletronics.uploadguard.domain.policy.AccessPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Decides whether a path may be read at all. Every scanner calls this before touching content.
 *
 * <p>Checks run in order: null byte, symbolic link, real-path resolution, allowed roots. When neither the
 * policy nor the environment supplies a root, every resolvable path is allowed and a warning is logged
 * once; integrators should always configure roots for production use.</p>
 */
public class AccessValidator {

    private static final Logger log = LoggerFactory.getLogger(AccessValidator.class);

    private final List<Path> environmentRoots;
    private final AtomicBoolean allowAllWarned = new AtomicBoolean();

    /**
     * @param environmentRoots roots used when a policy names none (e.g. system temp dir, storage root)
     */
    public AccessValidator(List<Path> environmentRoots) {
        this.environmentRoots = environmentRoots == null ? List.of() : List.copyOf(environmentRoots);
    }

    /** Roots from the system temp directory only. */
    public static AccessValidator withSystemDefaults() {
        List<Path> roots = new ArrayList<>();
        String tmp = System.getProperty("java.io.tmpdir");
        if (tmp != null && !tmp.isBlank()) {
            roots.add(Paths.get(tmp));
        }
        return new AccessValidator(roots);
    }

    public AccessDecision validate(String rawPath, AccessPolicy policy) {
        if (rawPath == null) return AccessDecision.deny(Denial.UNRESOLVED);
        if (rawPath.indexOf('\0') >= 0) return AccessDecision.deny(Denial.NULL_BYTE);
        try {
            return validate(Paths.get(rawPath), policy);
        } catch (InvalidPathException e) {
            return AccessDecision.deny(Denial.UNRESOLVED);
        }
    }

    public AccessDecision validate(Path path, AccessPolicy policy) {
        Objects.requireNonNull(policy, "policy");
        if (path == null) return AccessDecision.deny(Denial.UNRESOLVED);
        if (path.toString().indexOf('\0') >= 0) return AccessDecision.deny(Denial.NULL_BYTE);

        if (policy.checkSymlinks() && Files.isSymbolicLink(path)) {
            return AccessDecision.deny(Denial.SYMLINK);
        }

        Path real;
        try {
            real = path.toRealPath();
        } catch (IOException | SecurityException e) {
            return AccessDecision.deny(Denial.UNRESOLVED);
        }

        List<Path> configured = policy.allowedRoots().isEmpty() ? environmentRoots : policy.allowedRoots();
        if (configured.isEmpty()) {
            if (allowAllWarned.compareAndSet(false, true)) {
                log.warn("No allowed roots configured or available; every readable path will be accepted");
            }
            return AccessDecision.allow();
        }
        for (Path root : resolveRoots(configured)) {
            if (real.startsWith(root)) {
                return AccessDecision.allow();
            }
        }
        return AccessDecision.deny(Denial.OUTSIDE_ALLOWED_ROOTS);
    }

    /**
     * Opens a validated path for reading. Symbolic links are not followed when the policy checks them,
     * so a link swapped in after validation fails to open instead of being read.
     */
    public InputStream open(Path path, AccessPolicy policy) throws IOException {
        return Files.newInputStream(path, readOptions(policy));
    }

    /** Random-access variant of {@link #open} for container formats that seek to a central directory. */
    public SeekableByteChannel openChannel(Path path, AccessPolicy policy) throws IOException {
        return Files.newByteChannel(path, readOptions(policy));
    }

    public byte[] readPrefix(Path path, int length, AccessPolicy policy) throws IOException {
        try (InputStream in = open(path, policy)) {
            return in.readNBytes(length);
        }
    }

    public byte[] readAll(Path path, AccessPolicy policy) throws IOException {
        try (InputStream in = open(path, policy)) {
            return in.readAllBytes();
        }
    }

    private static OpenOption[] readOptions(AccessPolicy policy) {
        return policy.checkSymlinks()
                ? new OpenOption[]{StandardOpenOption.READ, LinkOption.NOFOLLOW_LINKS}
                : new OpenOption[]{StandardOpenOption.READ};
    }

    private static List<Path> resolveRoots(List<Path> configured) {
        List<Path> out = new ArrayList<>(configured.size());
        for (Path root : configured) {
            try {
                out.add(root.toRealPath());
            } catch (IOException | SecurityException e) {
                log.debug("Skipping unresolvable allowed root {}: {}", root, e.toString());
            }
        }
        return out;
    }
}
