package uk.gegc.railintel.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs used by the API.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://rail-doc-intel.gegc.uk/docs/errors";

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Processing Errors ====================
    public static final URI DOCUMENT_PROCESSING_FAILED = URI.create(BASE_URL + "/document-processing-failed");
    public static final URI CHUNKING_FAILED = URI.create(BASE_URL + "/chunking-failed");

    // ==================== AI Service Errors ====================
    public static final URI RATE_LIMIT_EXCEEDED = URI.create(BASE_URL + "/rate-limit-exceeded");
    public static final URI AI_SERVICE_UNAVAILABLE = URI.create(BASE_URL + "/ai-service-unavailable");
    public static final URI AI_SERVICE_ERROR = URI.create(BASE_URL + "/ai-service-error");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
