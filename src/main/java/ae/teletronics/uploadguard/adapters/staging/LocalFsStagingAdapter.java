package ae.teletronics.uploadguard.adapters.staging;

import ae.teletronics.uploadguard.ports.StagingPort;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public class LocalFsStagingAdapter implements StagingPort {

    private final Path rootDir;

    public LocalFsStagingAdapter(Path rootDir) {
        this.rootDir = Objects.requireNonNull(rootDir, "rootDir").toAbsolutePath().normalize();
    }

    @Override
    public Path allocate() throws IOException {
        Files.createDirectories(rootDir);
        return Files.createTempFile(rootDir, "upload-", ".bin");
    }

    @Override
    public void release(Path staged) throws IOException {
        Path p = staged.toAbsolutePath().normalize();
        if (!p.startsWith(rootDir)) {
            throw new IOException("Refusing to delete outside staging directory: " + staged);
        }
        Files.deleteIfExists(p);
    }

    @Override
    public Path root() {
        return rootDir;
    }
}
