package ai.bundlewatch.backend.service.evidence;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Thin FHIR R4 REST client: search, read and capability statement.
 * Errors propagate as {@link RestClientException}; callers decide how to degrade.
 */
@Component
public class FhirRestClient {

    private static final Logger logger = LoggerFactory.getLogger(FhirRestClient.class);

    private final RestTemplate restTemplate;
    private final String baseUrl;

    @Autowired
    public FhirRestClient(@Qualifier("fhir") RestTemplate restTemplate,
                          @Value("${fhir.base-url}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /**
     * Runs a search and returns the resources of the first result page.
     *
     * @param resourceType FHIR resource type, e.g. "Observation"
     * @param params       search parameters
     * @return resources from the searchset bundle entries
     */
    public List<JsonNode> search(String resourceType, MultiValueMap<String, String> params) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment(resourceType)
                .queryParams(params)
                .encode()
                .build()
                .toUri();
        logger.debug("FHIR search: {}", uri);
        JsonNode bundle = restTemplate.getForObject(uri, JsonNode.class);
        return extractEntries(bundle);
    }

    /**
     * Reads a single resource by id.
     *
     * @return the resource, or empty when the server answers 404
     */
    public Optional<JsonNode> read(String resourceType, String id) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .pathSegment(resourceType, id)
                .encode()
                .build()
                .toUri();
        try {
            return Optional.ofNullable(restTemplate.getForObject(uri, JsonNode.class));
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    /**
     * Fetches the server's capability statement, used for health checks.
     */
    public JsonNode capabilities() {
        return restTemplate.getForObject(baseUrl + "/metadata", JsonNode.class);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    static List<JsonNode> extractEntries(JsonNode bundle) {
        List<JsonNode> resources = new ArrayList<>();
        if (bundle == null) {
            return resources;
        }
        for (JsonNode entry : bundle.path("entry")) {
            JsonNode resource = entry.path("resource");
            if (!resource.isMissingNode()) {
                resources.add(resource);
            }
        }
        return resources;
    }
}
