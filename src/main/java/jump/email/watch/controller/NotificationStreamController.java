package jump.email.watch.controller;

import jump.email.watch.service.SseNotificationGateway;
import org.springframework.http.MediaType;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Realtime stream of new-mail events for the signed-in user. Keeping a stream open is what
 * keeps the user's watch processing notifications.
 */
@RestController
public class NotificationStreamController {
    private final SseNotificationGateway gateway;

    public NotificationStreamController(SseNotificationGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping(value = "/api/watch/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(Authentication authentication) {
        return gateway.connect(AuthenticatedPrincipal.id(authentication));
    }
}
