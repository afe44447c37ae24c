package jump.email.watch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of a Pub/Sub push delivery.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushEnvelope {
    private PushMessage message;
    private String subscription;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PushMessage {
        private String data;
        private String messageId;
        private String publishTime;
        private Map<String, String> attributes;
    }
}
