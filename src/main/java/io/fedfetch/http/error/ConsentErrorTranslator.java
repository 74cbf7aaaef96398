package io.fedfetch.http.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Recognizes the "agreement required" error body of the identity provider,
 * {@code {"error_description": "...", "resolution_url": "..."}}, and turns it into a message
 * that tells the user where to accept the agreement.
 */
public class ConsentErrorTranslator {

    private static final Logger log = LoggerFactory.getLogger(ConsentErrorTranslator.class);

    static final String ERROR_DESCRIPTION = "error_description";
    static final String RESOLUTION_URL = "resolution_url";

    private final ObjectMapper objectMapper;

    public ConsentErrorTranslator() {
        this(new ObjectMapper());
    }

    public ConsentErrorTranslator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param responseBody the body of a failed response, may be null
     * @return the consent requirement, or empty if the body does not have the expected shape
     */
    public Optional<ConsentRequirement> tryTranslate(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            log.trace("Failure body is not JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        if (root == null || !root.isObject() || !root.has(ERROR_DESCRIPTION) || !root.has(RESOLUTION_URL)) {
            return Optional.empty();
        }

        JsonNode urlNode = root.get(RESOLUTION_URL);
        if (!urlNode.isTextual() || urlNode.asText().isBlank()) {
            log.trace("Ignoring failure body whose {} is not a string", RESOLUTION_URL);
            return Optional.empty();
        }
        String resolutionUrl = urlNode.asText();
        String message = "Request could not be completed because you need to agree to the EULA at " + resolutionUrl;
        return Optional.of(new ConsentRequirement(message, resolutionUrl));
    }

    public boolean isConsentError(String responseBody) {
        return tryTranslate(responseBody).isPresent();
    }
}
