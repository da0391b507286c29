package ae.teletronics.uploadguard.ports;

import java.io.IOException;
import java.util.Optional;

/**
 * Generic content sniffing used when no known signature matches.
 * Should not assume the stream supports mark/reset; always use the provided StreamSource.
 */
public interface FileTypeDetector {

    /**
     * @param source re-openable source to inspect, usually a bounded prefix of the file
     * @return media type (RFC 2046, e.g. "application/pdf"), empty when the content is not recognised
     */
    Optional<String> detect(StreamSource source) throws IOException;
}
