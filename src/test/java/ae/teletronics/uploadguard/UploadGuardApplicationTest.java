package ae.teletronics.uploadguard;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.BodyInserters;

import java.nio.charset.StandardCharsets;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
class UploadGuardApplicationTest {

    @Autowired
    WebTestClient client;

    private static MultipartBodyBuilder upload(String name, byte[] content) {
        MultipartBodyBuilder mb = new MultipartBodyBuilder();
        mb.part("file", new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return name;
            }
        });
        return mb;
    }

    @Test
    void plain_text_upload_is_safe() {
        client.post().uri("/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(
                        upload("notes.txt", "Lunch at noon.\n".getBytes(StandardCharsets.UTF_8)).build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.safe").isEqualTo(true)
                .jsonPath("$.detectedType").isEqualTo("text/plain");
    }

    @Test
    void php_disguised_as_image_is_rejected() {
        byte[] php = "<?php echo shell_exec($_GET['c']); ?>".getBytes(StandardCharsets.US_ASCII);

        client.post().uri("/scan")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(upload("avatar.jpg", php).build()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.safe").isEqualTo(false)
                .jsonPath("$.detectedType").isEqualTo("application/x-php")
                .jsonPath("$.threats[0]").isEqualTo("Dangerous file type detected: application/x-php");
    }

    @Test
    void archive_limits_reflect_configuration() {
        client.get().uri("/scan/policy/limits")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.maxDepth").isEqualTo(3);
    }
}
