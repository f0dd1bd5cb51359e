package app.magicrows.enrichment.provider;

import app.magicrows.enrichment.error.EnrichmentException;
import app.magicrows.enrichment.error.ProviderRequestException;
import app.magicrows.enrichment.error.ProviderResponseException;
import app.magicrows.enrichment.error.ProviderTransientException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

public final class ProviderErrors {

    private static final int MAX_BODY_LENGTH = 200;

    private ProviderErrors() {
    }

    public static EnrichmentException translate(ProviderType type, RestClientException ex) {
        String provider = type.value();
        if (ex instanceof RestClientResponseException responseEx) {
            int status = responseEx.getStatusCode().value();
            String message = provider + " request failed with HTTP " + status + summarizeBody(responseEx);
            if (isTransient(status)) {
                return new ProviderTransientException(message, status, ex);
            }
            if (status >= 400 && status < 500) {
                return new ProviderRequestException(message, status, ex);
            }
            return new ProviderResponseException(message, responseEx.getResponseBodyAsString(), ex);
        }
        if (ex instanceof ResourceAccessException) {
            return new ProviderTransientException(provider + " request I/O failure: " + ex.getMessage(), null, ex);
        }
        return new ProviderResponseException(provider + " response could not be read: " + ex.getMessage(), null, ex);
    }

    public static boolean isTransient(int status) {
        return status == 408 || status == 409 || status == 429 || status >= 500;
    }

    private static String summarizeBody(RestClientResponseException ex) {
        String body = ex.getResponseBodyAsString();
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        if (trimmed.length() > MAX_BODY_LENGTH) {
            trimmed = trimmed.substring(0, MAX_BODY_LENGTH);
        }
        return ": " + trimmed;
    }
}
