package jump.email.watch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jump.email.watch.exception.NotificationDecodeException;
import jump.email.watch.model.NotificationEvent;
import jump.email.watch.model.PushEnvelope;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Parses Gmail Pub/Sub deliveries into {@link NotificationEvent}s. Stateless and free of side
 * effects; anything malformed becomes a {@link NotificationDecodeException}.
 */
@Component
public class NotificationDecoder {
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public NotificationDecoder(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public NotificationEvent decode(PushEnvelope envelope) {
        if (envelope == null || envelope.getMessage() == null) {
            throw new NotificationDecodeException("Push envelope has no message");
        }
        PushEnvelope.PushMessage message = envelope.getMessage();
        return decodeData(message.getData(), message.getMessageId(), message.getPublishTime());
    }

    /**
     * Decodes the base64 {@code data} of a push or pulled message.
     */
    public NotificationEvent decodeData(String data, String messageId, String publishTime) {
        if (data == null || data.isBlank()) {
            throw new NotificationDecodeException("Message has no data");
        }
        if (messageId == null || messageId.isBlank()) {
            throw new NotificationDecodeException("Message has no messageId");
        }
        return parsePayload(base64(data), messageId, publishTime);
    }

    /**
     * Parses an already decoded JSON payload; pulled messages arrive this way.
     */
    public NotificationEvent decodePayload(byte[] payload, String messageId, String publishTime) {
        if (payload == null || payload.length == 0) {
            throw new NotificationDecodeException("Message has no data");
        }
        if (messageId == null || messageId.isBlank()) {
            throw new NotificationDecodeException("Message has no messageId");
        }
        return parsePayload(payload, messageId, publishTime);
    }

    private NotificationEvent parsePayload(byte[] payload, String messageId, String publishTime) {
        JsonNode json;
        try {
            json = objectMapper.readTree(new String(payload, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new NotificationDecodeException("Message data is not JSON", e);
        }
        if (json == null || !json.isObject()) {
            throw new NotificationDecodeException("Message data is not a JSON object");
        }

        JsonNode emailAddress = json.get("emailAddress");
        if (emailAddress == null || !emailAddress.isTextual() || emailAddress.asText().isBlank()) {
            throw new NotificationDecodeException("Notification has no emailAddress");
        }

        return NotificationEvent.builder()
            .providerAccountId(emailAddress.asText())
            .notifiedCursor(historyId(json.get("historyId")))
            .receivedAt(receivedAt(publishTime))
            .deliveryId(messageId)
            .build();
    }

    private static byte[] base64(String data) {
        try {
            return Base64.getDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            try {
                return Base64.getUrlDecoder().decode(data);
            } catch (IllegalArgumentException urlSafe) {
                throw new NotificationDecodeException("Message data is not base64", urlSafe);
            }
        }
    }

    private static BigInteger historyId(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new NotificationDecodeException("Notification has no historyId");
        }
        BigInteger value;
        if (node.isIntegralNumber()) {
            value = node.bigIntegerValue();
        } else if (node.isTextual()) {
            try {
                value = new BigInteger(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new NotificationDecodeException("historyId is not an integer: " + node.asText(), e);
            }
        } else {
            throw new NotificationDecodeException("historyId has unexpected type " + node.getNodeType());
        }
        if (value.signum() < 0) {
            throw new NotificationDecodeException("historyId is negative: " + value);
        }
        return value;
    }

    private Instant receivedAt(String publishTime) {
        if (publishTime != null && !publishTime.isBlank()) {
            try {
                return Instant.parse(publishTime);
            } catch (DateTimeParseException e) {
                return clock.instant();
            }
        }
        return clock.instant();
    }
}
