package jump.email.watch.service;

import com.fasterxml.jackson.databind.JsonNode;
import jump.email.watch.config.WatchProperties;
import jump.email.watch.model.CanonicalMessage;
import jump.email.watch.model.SourceContext;
import jump.email.watch.model.TriageReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Posts canonical messages to the triage service at {@code watch.triage.endpoint-url}.
 * Without an endpoint, messages are only logged.
 */
@Slf4j
@Service
public class RestTriageClient implements TriageClient {
    static final String STATUS_SKIPPED = "SKIPPED";

    private final RestTemplate restTemplate;
    private final WatchProperties properties;

    public RestTriageClient(RestTemplate restTemplate, WatchProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public TriageReceipt submit(CanonicalMessage message, SourceContext context) {
        String endpoint = properties.getTriage().getEndpointUrl();
        if (endpoint == null || endpoint.isBlank()) {
            log.debug("No triage endpoint configured; message {} for {} not submitted", message.getId(), context.getPrincipalId());
            return new TriageReceipt(message.getId(), STATUS_SKIPPED);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("type", "email_triage");
        body.put("email", message);
        body.put("context", context);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<JsonNode> response = restTemplate.postForEntity(endpoint, new HttpEntity<>(body, headers), JsonNode.class);
        JsonNode json = response.getBody();
        String acceptedId = json != null && json.hasNonNull("id") ? json.get("id").asText() : message.getId();
        String status = json != null && json.hasNonNull("status") ? json.get("status").asText() : response.getStatusCode().toString();
        log.info("Submitted message {} for triage as {} ({})", message.getId(), acceptedId, status);
        return new TriageReceipt(acceptedId, status);
    }
}
