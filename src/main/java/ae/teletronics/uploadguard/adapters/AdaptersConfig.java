package ae.teletronics.uploadguard.adapters;

import ae.teletronics.uploadguard.adapters.config.UploadGuardProperties;
import ae.teletronics.uploadguard.adapters.detection.TikaFileTypeDetector;
import ae.teletronics.uploadguard.adapters.logging.Slf4jSecurityEventSink;
import ae.teletronics.uploadguard.adapters.staging.LocalFsStagingAdapter;
import ae.teletronics.uploadguard.application.ContentScanEngine;
import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.application.detection.FormatIdentifier;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import ae.teletronics.uploadguard.ports.FileTypeDetector;
import ae.teletronics.uploadguard.ports.SecurityEventSink;
import ae.teletronics.uploadguard.ports.StagingPort;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

@Configuration
@Profile("!test")
@EnableConfigurationProperties(UploadGuardProperties.class)
public class AdaptersConfig {

    @Bean
    @ConditionalOnMissingBean(StagingPort.class)
    public StagingPort stagingPort(
            @Value("${uploadguard.staging-dir:${java.io.tmpdir}/uploadguard}") String stagingDir
    ) throws IOException {
        Path root = Paths.get(stagingDir).toAbsolutePath().normalize();
        Files.createDirectories(root);
        return new LocalFsStagingAdapter(root);
    }

    @Bean
    @ConditionalOnMissingBean(FileTypeDetector.class)
    public FileTypeDetector fileTypeDetector() {
        return new TikaFileTypeDetector();
    }

    @Bean
    @ConditionalOnMissingBean(SecurityEventSink.class)
    public SecurityEventSink securityEventSink(UploadGuardProperties props) {
        return new Slf4jSecurityEventSink(props.getLogging().isEnabled(), props.getLogging().isDetailed());
    }

    /** Staged uploads must always pass the root check, so the staging directory joins any configured roots. */
    @Bean
    @ConditionalOnMissingBean(ScanPolicy.class)
    public ScanPolicy scanPolicy(UploadGuardProperties props, StagingPort staging) {
        ScanPolicy policy = props.toPolicy();
        if (policy.access().allowedRoots().isEmpty()) {
            return policy;
        }
        List<Path> roots = new ArrayList<>(policy.access().allowedRoots());
        roots.add(staging.root());
        return policy.withAccess(policy.access().withAllowedRoots(roots));
    }

    @Bean
    @ConditionalOnMissingBean(AccessValidator.class)
    public AccessValidator accessValidator(UploadGuardProperties props, StagingPort staging) {
        List<Path> roots = new ArrayList<>();
        roots.add(Paths.get(System.getProperty("java.io.tmpdir")));
        roots.add(staging.root());
        String storageRoot = props.getAccess().getStorageRoot();
        if (storageRoot != null && !storageRoot.isBlank()) {
            roots.add(Paths.get(storageRoot));
        }
        return new AccessValidator(roots);
    }

    @Bean
    @ConditionalOnMissingBean(FormatIdentifier.class)
    public FormatIdentifier formatIdentifier(FileTypeDetector detector, AccessValidator access) {
        return new FormatIdentifier(detector, access);
    }

    @Bean
    @ConditionalOnMissingBean(ContentScanEngine.class)
    public ContentScanEngine contentScanEngine(AccessValidator access,
                                               FormatIdentifier formats,
                                               SecurityEventSink events) {
        return ContentScanEngine.create(access, formats, events);
    }
}
