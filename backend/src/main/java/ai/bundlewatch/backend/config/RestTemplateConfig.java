package ai.bundlewatch.backend.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * Configuration for the RestTemplate used against the FHIR server.
 * Requests carry FHIR JSON accept headers and, when configured, a bearer token.
 */
@Configuration
public class RestTemplateConfig {

    private static final String FHIR_JSON = "application/fhir+json";

    /**
     * Creates the FHIR RestTemplate with configured timeouts.
     *
     * @return configured RestTemplate instance
     */
    @Bean
    @Qualifier("fhir")
    public RestTemplate fhirRestTemplate(
            @Value("${fhir.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${fhir.read-timeout-ms:30000}") int readTimeoutMs,
            @Value("${fhir.bearer-token:}") String bearerToken) {
        RestTemplate restTemplate = new RestTemplate(clientHttpRequestFactory(connectTimeoutMs, readTimeoutMs));
        restTemplate.getInterceptors().add(fhirHeaders(bearerToken));
        return restTemplate;
    }

    private ClientHttpRequestFactory clientHttpRequestFactory(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return factory;
    }

    private ClientHttpRequestInterceptor fhirHeaders(String bearerToken) {
        return (request, body, execution) -> {
            request.getHeaders().set(HttpHeaders.ACCEPT, FHIR_JSON);
            if (bearerToken != null && !bearerToken.isBlank()) {
                request.getHeaders().setBearerAuth(bearerToken);
            }
            return execution.execute(request, body);
        };
    }
}
