package ae.teletronics.uploadguard.adapters.web;

import ae.teletronics.uploadguard.application.ScanService;
import ae.teletronics.uploadguard.domain.model.ScanFlag;
import ae.teletronics.uploadguard.domain.model.ScanResult;
import ae.teletronics.uploadguard.domain.model.ThreatType;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = ScanController.class)
class ScanControllerTest {

    @Autowired
    WebTestClient client;

    @MockBean
    ScanService scanService;

    private static MultipartBodyBuilder upload(String name, String content) {
        MultipartBodyBuilder mb = new MultipartBodyBuilder();
        mb.part("file", new ByteArrayResource(content.getBytes(StandardCharsets.UTF_8)) {
            @Override
            public String getFilename() {
                return name;
            }
        });
        return mb;
    }

    @Test
    void clean_upload_returns_safe_verdict() {
        ScanResult clean = ScanResult.builder("engine")
                .detail("detectedType", "text/plain")
                .flag(ScanFlag.BINARY_SKIPPED)
                .build();
        when(scanService.scan(eq("notes.txt"), any())).thenReturn(Mono.just(clean));

        client.post().uri("/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("notes.txt", "hello").build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.filename").isEqualTo("notes.txt")
                .jsonPath("$.safe").isEqualTo(true)
                .jsonPath("$.detectedType").isEqualTo("text/plain")
                .jsonPath("$.threats").isEmpty()
                .jsonPath("$.flags[0]").isEqualTo("binary_skipped");
    }

    @Test
    void threats_are_listed_in_order() {
        ScanResult rejected = ScanResult.builder("engine")
                .detail("detectedType", "application/x-php")
                .finding(ThreatType.DANGEROUS_FILE, "Dangerous file type detected: application/x-php")
                .finding(ThreatType.CODE_INJECTION, "PHP opening tag (<?php) detected")
                .build();
        when(scanService.scan(eq("avatar.jpg"), any())).thenReturn(Mono.just(rejected));

        client.post().uri("/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("avatar.jpg", "<?php").build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.safe").isEqualTo(false)
                .jsonPath("$.threats.length()").isEqualTo(2)
                .jsonPath("$.threats[0]").isEqualTo("Dangerous file type detected: application/x-php")
                .jsonPath("$.threats[1]").isEqualTo("PHP opening tag (<?php) detected");
    }

    @Test
    void filename_part_overrides_the_upload_name() {
        when(scanService.scan(eq("report.pdf"), any()))
                .thenReturn(Mono.just(ScanResult.builder("engine").build()));
        MultipartBodyBuilder mb = upload("blob.bin", "%PDF-1.4");
        mb.part("filename", "report.pdf");

        client.post().uri("/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(mb.build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.filename").isEqualTo("report.pdf")
                .jsonPath("$.detectedType").isEqualTo("application/octet-stream");

        verify(scanService).scan(eq("report.pdf"), any());
    }

    @Test
    void service_argument_errors_map_to_400() {
        when(scanService.scan(any(), any()))
                .thenReturn(Mono.error(new IllegalArgumentException("filename is required")));

        client.post().uri("/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("x.txt", "x").build()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("BAD_REQUEST")
                .jsonPath("$.message").isEqualTo("filename is required");
    }

    @Test
    void staging_failure_maps_to_503() {
        when(scanService.scan(any(), any()))
                .thenReturn(Mono.error(new IOException("No space left on device")));

        client.post().uri("/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("x.txt", "x").build()))
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.code").isEqualTo("STAGING_UNAVAILABLE");
    }

    @Test
    void missing_file_part_is_400() {
        MultipartBodyBuilder mb = new MultipartBodyBuilder();
        mb.part("filename", "a.txt");

        client.post().uri("/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(mb.build()))
                .exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(scanService);
    }

    @Test
    void non_multipart_body_is_415() {
        client.post().uri("/scan")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{}")
                .exchange()
                .expectStatus().isEqualTo(415);
    }

    @Test
    void archive_limits_are_exposed() {
        when(scanService.policy()).thenReturn(ScanPolicy.defaults());

        client.get().uri("/scan/policy/limits")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.maxCompressionRatio").isEqualTo(100)
                .jsonPath("$.maxFiles").isEqualTo(10000)
                .jsonPath("$.maxDepth").isEqualTo(3)
                .jsonPath("$.failOpenWhenBackendMissing").isEqualTo(false);
    }
}
