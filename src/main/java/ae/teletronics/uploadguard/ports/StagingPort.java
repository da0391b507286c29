package ae.teletronics.uploadguard.ports;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Local area where uploads are written before they are scanned.
 */
public interface StagingPort {

    /** Reserves a fresh, empty file inside the staging area. */
    Path allocate() throws IOException;

    /** Removes a staged file. Idempotent. */
    void release(Path staged) throws IOException;

    Path root();
}
