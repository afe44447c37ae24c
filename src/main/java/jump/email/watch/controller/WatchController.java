package jump.email.watch.controller;

import jump.email.watch.entity.LabelFilter;
import jump.email.watch.entity.WatchRecord;
import jump.email.watch.exception.WatchNotFoundException;
import jump.email.watch.model.CreateWatchRequest;
import jump.email.watch.model.WatchStatusView;
import jump.email.watch.service.WatchSubscriptionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Lets a signed-in user enable, inspect, renew and disable notifications for their mailbox.
 */
@RestController
@RequestMapping("/api/watch")
public class WatchController {
    private final WatchSubscriptionService subscriptionService;

    public WatchController(WatchSubscriptionService subscriptionService) {
        this.subscriptionService = subscriptionService;
    }

    @PostMapping
    public ResponseEntity<WatchStatusView> create(@RequestBody(required = false) CreateWatchRequest request,
                                                  Authentication authentication) {
        LabelFilter filter = request != null
            ? LabelFilter.of(request.getLabelIds(), request.getLabelFilterBehavior())
            : LabelFilter.inbox();
        WatchRecord record = subscriptionService.create(AuthenticatedPrincipal.id(authentication), filter);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(WatchStatusView.from(record, AuthenticatedPrincipal.email(authentication)));
    }

    @GetMapping
    public WatchStatusView status(Authentication authentication) {
        String principalId = AuthenticatedPrincipal.id(authentication);
        return subscriptionService.getStatus(principalId, AuthenticatedPrincipal.email(authentication))
            .orElseThrow(() -> new WatchNotFoundException("No watch for principal " + principalId));
    }

    @PostMapping("/renew")
    public WatchStatusView renew(Authentication authentication) {
        WatchRecord record = subscriptionService.renewForPrincipal(AuthenticatedPrincipal.id(authentication));
        return WatchStatusView.from(record, AuthenticatedPrincipal.email(authentication));
    }

    @DeleteMapping
    public Map<String, Boolean> stop(Authentication authentication) {
        return Map.of("stopped", subscriptionService.stop(AuthenticatedPrincipal.id(authentication)));
    }
}
