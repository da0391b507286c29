package ae.teletronics.uploadguard.adapters.web;

import ae.teletronics.uploadguard.adapters.web.dto.ArchiveLimitsDto;
import ae.teletronics.uploadguard.adapters.web.dto.ScanResponse;
import ae.teletronics.uploadguard.application.ScanService;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Optional;

@RestController
@RequestMapping("/scan")
@Validated
public class ScanController {

    private final ScanService scanService;

    public ScanController(ScanService scanService) {
        this.scanService = scanService;
    }

    /**
     * Scans one uploaded file. The optional {@code filename} part overrides the name sent with the file;
     * either way the name only steers extension checks, never type detection.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ScanResponse> scan(@RequestPart("file") FilePart file,
                                   @RequestPart(name = "filename", required = false) String filename) {
        final String effectiveFilename = Optional.ofNullable(filename).filter(s -> !s.isBlank())
                .orElse(file.filename());
        return scanService.scan(effectiveFilename, file.content())
                .map(result -> ScanResponse.from(effectiveFilename, result));
    }

    @GetMapping(path = "/policy/limits", produces = MediaType.APPLICATION_JSON_VALUE)
    public ArchiveLimitsDto limits() {
        return ArchiveLimitsDto.from(scanService.policy().archive());
    }
}
