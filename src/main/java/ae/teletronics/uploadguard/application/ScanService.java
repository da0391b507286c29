package ae.teletronics.uploadguard.application;

import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ScanTarget;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import ae.teletronics.uploadguard.ports.StagingPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Stages an upload on local disk, scans it and removes it again. The scan itself is blocking file I/O and
 * runs on the bounded-elastic scheduler.
 */
@Service
public class ScanService {

    private static final Logger log = LoggerFactory.getLogger(ScanService.class);

    private final ContentScanEngine engine;
    private final StagingPort staging;
    private final ScanPolicy policy;

    public ScanService(ContentScanEngine engine, StagingPort staging, ScanPolicy policy) {
        this.engine = engine;
        this.staging = staging;
        this.policy = policy;
    }

    public Mono<ScanResult> scan(String filename, Flux<DataBuffer> body) {
        if (filename == null || filename.isBlank()) {
            return Mono.error(new IllegalArgumentException("filename is required"));
        }
        return Mono.usingWhen(
                Mono.fromCallable(staging::allocate).subscribeOn(Schedulers.boundedElastic()),
                staged -> DataBufferUtils.write(body, staged, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)
                        .then(Mono.fromCallable(() -> engine.scanFile(new ScanTarget(staged, filename), policy))
                                .subscribeOn(Schedulers.boundedElastic())),
                staged -> Mono.fromRunnable(() -> release(staged)).subscribeOn(Schedulers.boundedElastic()));
    }

    public ScanPolicy policy() {
        return policy;
    }

    private void release(Path staged) {
        try {
            staging.release(staged);
        } catch (IOException e) {
            log.warn("Unable to remove staged upload {}: {}", staged, e.toString());
        }
    }
}
