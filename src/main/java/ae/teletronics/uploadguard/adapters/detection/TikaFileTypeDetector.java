package ae.teletronics.uploadguard.adapters.detection;

import ae.teletronics.uploadguard.ports.FileTypeDetector;
import ae.teletronics.uploadguard.ports.StreamSource;
import org.apache.tika.config.TikaConfig;
import org.apache.tika.detect.DefaultDetector;
import org.apache.tika.io.TikaInputStream;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.mime.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Apache Tika-based content sniffer. Only bytes are inspected; no resource name is passed, so a
 * misleading extension cannot steer the answer.
 */
public class TikaFileTypeDetector implements FileTypeDetector {

    private static final Logger log = LoggerFactory.getLogger(TikaFileTypeDetector.class);

    private final DefaultDetector detector;

    public TikaFileTypeDetector() {
        this.detector = new DefaultDetector(TikaConfig.getDefaultConfig().getMimeRepository());
    }

    @Override
    public Optional<String> detect(StreamSource source) throws IOException {
        try (InputStream raw = source.openStream();
             TikaInputStream in = TikaInputStream.get(raw)) {
            MediaType mediaType = detector.detect(in, new Metadata());
            if (mediaType != null) {
                String asString = mediaType.getBaseType().toString();
                // Tika answers "application/octet-stream" for unknowns
                if (!MediaType.OCTET_STREAM.toString().equals(asString)) {
                    return Optional.of(asString);
                }
            }
        } catch (RuntimeException e) {
            log.debug("Tika detection failed: {}", e.toString());
        }
        return Optional.empty();
    }
}
