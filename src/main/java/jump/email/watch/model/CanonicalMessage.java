package jump.email.watch.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Normalized form of one inbound email handed to triage and the realtime stream.
 */
@Value
@Builder
public class CanonicalMessage {
    String id;
    String threadId;
    String body;
    String subject;
    String from;
    String to;
    Instant timestamp;
    List<String> providerLabels;
    String principalId;
}
