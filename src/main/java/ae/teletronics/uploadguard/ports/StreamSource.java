package ae.teletronics.uploadguard.ports;

import java.io.IOException;
import java.io.InputStream;

/**
 * Re-openable source of bytes. Each call returns a fresh stream the caller must close.
 */
@FunctionalInterface
public interface StreamSource {
    InputStream openStream() throws IOException;
}
