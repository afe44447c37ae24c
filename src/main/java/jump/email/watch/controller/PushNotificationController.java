package jump.email.watch.controller;

import jump.email.watch.config.WatchProperties;
import jump.email.watch.model.NotificationEvent;
import jump.email.watch.model.NotificationSource;
import jump.email.watch.model.PushEnvelope;
import jump.email.watch.model.ReconcileOutcome;
import jump.email.watch.service.HistoryReconciler;
import jump.email.watch.service.NotificationDecoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Receiver for Gmail Pub/Sub push deliveries.
 *
 * <p>Any envelope that decodes is acknowledged with 200, whatever reconciliation made of it,
 * so Pub/Sub does not retry notifications that cannot succeed. Malformed envelopes get 400.
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks/gmail")
public class PushNotificationController {
    private final NotificationDecoder decoder;
    private final HistoryReconciler reconciler;
    private final WatchProperties properties;

    public PushNotificationController(NotificationDecoder decoder, HistoryReconciler reconciler, WatchProperties properties) {
        this.decoder = decoder;
        this.reconciler = reconciler;
        this.properties = properties;
    }

    @PostMapping("/push")
    public ResponseEntity<Map<String, Object>> receive(@RequestBody(required = false) PushEnvelope envelope,
                                                       @RequestParam(value = "token", required = false) String token) {
        String expected = properties.getPubsub().getPushVerificationToken();
        if (expected != null && !expected.isBlank() && !expected.equals(token)) {
            log.warn("Rejected push delivery with a bad verification token");
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", false);
            body.put("error", "invalid verification token");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(body);
        }

        NotificationEvent event = decoder.decode(envelope);
        log.debug("Push notification {} for {} at historyId {}", event.getDeliveryId(), event.getProviderAccountId(), event.getNotifiedCursor());
        ReconcileOutcome outcome = reconciler.reconcile(event, NotificationSource.PUSH);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("status", outcome.getStatus());
        body.put("processed", outcome.getProcessedCount());
        return ResponseEntity.ok(body);
    }
}
