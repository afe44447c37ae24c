package jump.email.watch.service;

import com.google.api.services.gmail.model.Message;
import com.google.api.services.gmail.model.MessagePart;
import com.google.api.services.gmail.model.MessagePartHeader;
import jump.email.watch.config.WatchProperties;
import jump.email.watch.model.CanonicalMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Builds a {@link CanonicalMessage} from a full-format Gmail message. Plain text is preferred;
 * HTML parts are used with their tags stripped when no plain text exists.
 */
@Slf4j
@Component
public class CanonicalMessageMapper {
    private static final String TEXT_PLAIN = "text/plain";
    private static final String TEXT_HTML = "text/html";

    private final WatchProperties properties;
    private final Clock clock;

    public CanonicalMessageMapper(WatchProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public CanonicalMessage map(Message message, String principalId, String mailboxAddress) {
        if (message == null || message.getId() == null) {
            throw new IllegalArgumentException("Gmail message without an id");
        }
        String subject = "";
        String from = "";
        String to = null;
        MessagePart payload = message.getPayload();
        if (payload != null && payload.getHeaders() != null) {
            for (MessagePartHeader header : payload.getHeaders()) {
                if (header.getName() == null) {
                    continue;
                }
                switch (header.getName().toLowerCase(Locale.ROOT)) {
                    case "subject":
                        subject = header.getValue();
                        break;
                    case "from":
                        from = header.getValue();
                        break;
                    case "to":
                        to = header.getValue();
                        break;
                    default:
                        break;
                }
            }
        }

        String body = extractBody(payload);
        int limit = properties.getReconcile().getBodyCharLimit();
        if (body.length() > limit) {
            body = body.substring(0, limit);
        }

        Instant timestamp = message.getInternalDate() != null
            ? Instant.ofEpochMilli(message.getInternalDate())
            : clock.instant();

        return CanonicalMessage.builder()
            .id(message.getId())
            .threadId(message.getThreadId())
            .body(body)
            .subject(subject)
            .from(from)
            .to(to != null ? to : mailboxAddress)
            .timestamp(timestamp)
            .providerLabels(message.getLabelIds() != null ? List.copyOf(message.getLabelIds()) : List.of())
            .principalId(principalId)
            .build();
    }

    String extractBody(MessagePart part) {
        if (part == null) {
            return "";
        }
        if (part.getBody() != null && part.getBody().getData() != null) {
            String decoded = decode(part.getBody().getData());
            if (!decoded.isEmpty()) {
                return TEXT_HTML.equals(part.getMimeType()) ? stripTags(decoded) : decoded;
            }
        }
        if (part.getParts() == null) {
            return "";
        }
        for (MessagePart child : part.getParts()) {
            if (TEXT_PLAIN.equals(child.getMimeType())) {
                String body = extractBody(child);
                if (!body.isEmpty()) {
                    return body;
                }
            }
        }
        for (MessagePart child : part.getParts()) {
            if (TEXT_HTML.equals(child.getMimeType())) {
                String body = extractBody(child);
                if (!body.isEmpty()) {
                    return body;
                }
            }
        }
        for (MessagePart child : part.getParts()) {
            String body = extractBody(child);
            if (!body.isEmpty()) {
                return body;
            }
        }
        return "";
    }

    private String decode(String data) {
        // Gmail bodies are URL-safe base64, usually unpadded
        try {
            return new String(Base64.getUrlDecoder().decode(data), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            try {
                return new String(Base64.getMimeDecoder().decode(data), StandardCharsets.UTF_8);
            } catch (IllegalArgumentException e2) {
                log.warn("Could not decode message body part: {}", e2.getMessage());
                return "";
            }
        }
    }

    private static String stripTags(String html) {
        return html.replaceAll("<[^>]*>", "").trim();
    }
}
