package jump.email.watch.service;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;
import jump.email.watch.model.ProviderResult;

import java.util.Set;

/**
 * Turns Gmail client exceptions into provider outcomes. This is the only place status codes
 * are inspected.
 */
public final class GmailErrorClassifier {
    private static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded");

    private GmailErrorClassifier() {
    }

    public static ProviderResult.Outcome classify(Exception e) {
        if (!(e instanceof HttpResponseException)) {
            // IO errors and timeouts
            return ProviderResult.Outcome.TRANSIENT;
        }
        int status = ((HttpResponseException) e).getStatusCode();
        switch (status) {
            case 401:
                return ProviderResult.Outcome.AUTH_FAILURE;
            case 403:
                return isRateLimited(e) ? ProviderResult.Outcome.TRANSIENT : ProviderResult.Outcome.AUTH_FAILURE;
            case 404:
            case 410:
                return ProviderResult.Outcome.NOT_FOUND;
            default:
                return ProviderResult.Outcome.TRANSIENT;
        }
    }

    public static <T> ProviderResult<T> toResult(Exception e) {
        String message = describe(e);
        switch (classify(e)) {
            case AUTH_FAILURE:
                return ProviderResult.authFailure(message);
            case NOT_FOUND:
                return ProviderResult.notFound(message);
            default:
                return ProviderResult.transientFailure(message);
        }
    }

    private static boolean isRateLimited(Exception e) {
        if (!(e instanceof GoogleJsonResponseException)) {
            return false;
        }
        GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
        if (details == null || details.getErrors() == null) {
            return false;
        }
        return details.getErrors().stream()
            .anyMatch(error -> RATE_LIMIT_REASONS.contains(error.getReason()));
    }

    private static String describe(Exception e) {
        if (e instanceof GoogleJsonResponseException && ((GoogleJsonResponseException) e).getDetails() != null) {
            GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
            return details.getCode() + " " + details.getMessage();
        }
        if (e instanceof HttpResponseException) {
            HttpResponseException http = (HttpResponseException) e;
            return http.getStatusCode() + " " + http.getStatusMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
