package ae.teletronics.uploadguard.adapters.web.dto;

public record ErrorResponse(String code, String message) {
}
