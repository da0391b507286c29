package ae.teletronics.uploadguard.application.detection;

import ae.teletronics.uploadguard.application.access.AccessValidator;
import ae.teletronics.uploadguard.domain.model.DetectedType;
import ae.teletronics.uploadguard.domain.model.DetectedType.Source;
import ae.teletronics.uploadguard.domain.model.MediaTypes;
import ae.teletronics.uploadguard.domain.model.SignatureEntry;
import ae.teletronics.uploadguard.domain.policy.DetectionPolicy;
import ae.teletronics.uploadguard.domain.policy.ScanPolicy;
import ae.teletronics.uploadguard.ports.FileTypeDetector;
import ae.teletronics.uploadguard.ports.StreamSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FormatIdentifierTest {

    @Mock FileTypeDetector fallback;

    @TempDir
    Path tmp;

    private FormatIdentifier identifier() {
        return new FormatIdentifier(fallback, new AccessValidator(List.of(tmp)));
    }

    private static byte[] ascii(String s) {
        return s.getBytes(StandardCharsets.ISO_8859_1);
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] p : parts) out.writeBytes(p);
        return out.toByteArray();
    }

    @Test
    void every_builtin_signature_is_reachable() {
        FormatIdentifier id = identifier();
        for (SignatureEntry entry : SignatureTable.builtIns()) {
            byte[] window = concat(new byte[entry.offset()], entry.prefix());

            DetectedType detected = id.identify(window, DetectionPolicy.defaults());

            assertThat(detected.mediaType())
                    .as("signature for %s at offset %d", entry.mediaType(), entry.offset())
                    .isEqualTo(entry.mediaType());
            assertThat(detected.source()).isEqualTo(Source.SIGNATURE);
        }
    }

    @Test
    void longer_signature_wins_over_its_prefix() {
        FormatIdentifier id = identifier();

        assertThat(id.identify(new byte[]{0x4D, 0x5A, (byte) 0x90, 0x00, 0x03}, DetectionPolicy.defaults()).mediaType())
                .isEqualTo("application/x-dosexec");
        assertThat(id.identify(new byte[]{0x4D, 0x5A, 0x50, 0x00}, DetectionPolicy.defaults()).mediaType())
                .isEqualTo("application/x-msdownload");
    }

    @Test
    void riff_form_type_is_refined() {
        FormatIdentifier id = identifier();
        byte[] size = {0x24, 0, 0, 0};

        assertThat(id.identify(concat(ascii("RIFF"), size, ascii("WEBPVP8 ")), DetectionPolicy.defaults()).mediaType())
                .isEqualTo("image/webp");
        assertThat(id.identify(concat(ascii("RIFF"), size, ascii("AVI LIST")), DetectionPolicy.defaults()).mediaType())
                .isEqualTo("video/x-msvideo");
        assertThat(id.identify(concat(ascii("RIFF"), size, ascii("WAVEfmt ")), DetectionPolicy.defaults()).mediaType())
                .isEqualTo("audio/wav");
        assertThat(id.identify(concat(ascii("RIFF"), size, ascii("ABCDxxxx")), DetectionPolicy.defaults()).mediaType())
                .isEqualTo(MediaTypes.OCTET_STREAM);
    }

    @Test
    void iso_base_media_brand_is_refined() {
        FormatIdentifier id = identifier();
        byte[] box = {0, 0, 0, 0x20};

        assertThat(id.identify(concat(box, ascii("ftypisom")), DetectionPolicy.defaults()).mediaType()).isEqualTo("video/mp4");
        assertThat(id.identify(concat(box, ascii("ftypqt  ")), DetectionPolicy.defaults()).mediaType()).isEqualTo("video/quicktime");
        assertThat(id.identify(concat(box, ascii("ftypM4A ")), DetectionPolicy.defaults()).mediaType()).isEqualTo("audio/mp4");
        assertThat(id.identify(concat(box, ascii("ftypavif")), DetectionPolicy.defaults()).mediaType()).isEqualTo("image/avif");
        assertThat(id.identify(concat(box, ascii("ftypheic")), DetectionPolicy.defaults()).mediaType()).isEqualTo("image/heic");
        assertThat(id.identify(concat(box, ascii("ftypzzzz")), DetectionPolicy.defaults()).mediaType()).isEqualTo("video/mp4");
    }

    @Test
    void ooxml_is_told_apart_from_plain_zip() throws IOException {
        FormatIdentifier id = identifier();

        assertThat(id.identify(zip("word/document.xml"), DetectionPolicy.defaults()).mediaType()).isEqualTo(MediaTypes.DOCX);
        assertThat(id.identify(zip("xl/workbook.xml"), DetectionPolicy.defaults()).mediaType()).isEqualTo(MediaTypes.XLSX);
        assertThat(id.identify(zip("ppt/presentation.xml"), DetectionPolicy.defaults()).mediaType()).isEqualTo(MediaTypes.PPTX);
        assertThat(id.identify(zip("readme.txt"), DetectionPolicy.defaults()).mediaType()).isEqualTo(MediaTypes.ZIP);
    }

    @Test
    void xml_with_svg_root_is_svg() {
        FormatIdentifier id = identifier();

        assertThat(id.identify(ascii("<?xml version=\"1.0\"?>\n<svg xmlns=\"http://www.w3.org/2000/svg\"/>"),
                DetectionPolicy.defaults()).mediaType()).isEqualTo(MediaTypes.SVG);
        assertThat(id.identify(ascii("<?xml version=\"1.0\"?>\n<note/>"), DetectionPolicy.defaults()).mediaType())
                .isEqualTo("text/xml");
    }

    @Test
    void custom_signature_takes_priority_over_builtins() {
        FormatIdentifier id = identifier();
        Map<String, String> custom = new LinkedHashMap<>();
        custom.put("89504E47", "image/x-custom-png");
        DetectionPolicy policy = DetectionPolicy.defaults().withCustomSignatures(custom);

        DetectedType detected = id.identify(new byte[]{(byte) 0x89, 0x50, 0x4E, 0x47, 0x0D, 0x0A}, policy);

        assertThat(detected.mediaType()).isEqualTo("image/x-custom-png");
        assertThat(detected.source()).isEqualTo(Source.CUSTOM_SIGNATURE);
    }

    @Test
    void invalid_custom_signature_is_rejected() {
        assertThatThrownBy(() -> SignatureTable.parseCustom(Map.of("zz12", "x/y")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknown_prefix_asks_fallback() throws IOException {
        when(fallback.detect(any(StreamSource.class))).thenReturn(Optional.of("text/plain; charset=UTF-8"));

        DetectedType detected = identifier().identify(ascii("just some words"), DetectionPolicy.defaults());

        assertThat(detected).isEqualTo(new DetectedType("text/plain", Source.FALLBACK));
    }

    @Test
    void fallback_octet_stream_or_failure_is_unknown() throws IOException {
        when(fallback.detect(any(StreamSource.class)))
                .thenReturn(Optional.of(MediaTypes.OCTET_STREAM))
                .thenThrow(new IOException("boom"));
        FormatIdentifier id = identifier();

        assertThat(id.identify(new byte[]{1, 2, 3}, DetectionPolicy.defaults())).isEqualTo(DetectedType.UNKNOWN);
        assertThat(id.identify(new byte[]{1, 2, 3}, DetectionPolicy.defaults())).isEqualTo(DetectedType.UNKNOWN);
    }

    @Test
    void empty_input_is_unknown_without_fallback() throws IOException {
        assertThat(identifier().identify(new byte[0], DetectionPolicy.defaults())).isEqualTo(DetectedType.UNKNOWN);
        verify(fallback, never()).detect(any());
    }

    @Test
    void identify_reads_only_the_file_content() throws IOException {
        Path f = Files.write(tmp.resolve("photo.jpg"), ascii("%PDF-1.7\n%%EOF"));

        assertThat(identifier().identify(f, ScanPolicy.defaults()).mediaType()).isEqualTo(MediaTypes.PDF);
    }

    @Test
    void unreadable_file_is_unknown() {
        assertThat(identifier().identify(tmp.resolve("missing.bin"), ScanPolicy.defaults()))
                .isEqualTo(DetectedType.UNKNOWN);
    }

    private static byte[] zip(String partName) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            zip.putNextEntry(new ZipEntry("[Content_Types].xml"));
            zip.write(ascii("<Types/>"));
            zip.closeEntry();
            zip.putNextEntry(new ZipEntry(partName));
            zip.write(ascii("<x/>"));
            zip.closeEntry();
        }
        return bytes.toByteArray();
    }
}
