package jump.email.watch.service;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpHeaders;
import com.google.api.client.http.HttpResponseException;
import jump.email.watch.model.ProviderResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GmailErrorClassifierTest {

    private static HttpResponseException http(int status) {
        return new HttpResponseException.Builder(status, "status " + status, new HttpHeaders()).build();
    }

    private static GoogleJsonResponseException json(int status, String reason) {
        GoogleJsonError.ErrorInfo info = new GoogleJsonError.ErrorInfo();
        info.setReason(reason);
        GoogleJsonError error = new GoogleJsonError();
        error.setCode(status);
        error.setMessage(reason);
        error.setErrors(List.of(info));
        return new GoogleJsonResponseException(new HttpResponseException.Builder(status, reason, new HttpHeaders()), error);
    }

    @Test
    void classify_StatusCodes_ShouldMapToOutcomes() {
        assertEquals(ProviderResult.Outcome.AUTH_FAILURE, GmailErrorClassifier.classify(http(401)));
        assertEquals(ProviderResult.Outcome.AUTH_FAILURE, GmailErrorClassifier.classify(http(403)));
        assertEquals(ProviderResult.Outcome.NOT_FOUND, GmailErrorClassifier.classify(http(404)));
        assertEquals(ProviderResult.Outcome.NOT_FOUND, GmailErrorClassifier.classify(http(410)));
        assertEquals(ProviderResult.Outcome.TRANSIENT, GmailErrorClassifier.classify(http(429)));
        assertEquals(ProviderResult.Outcome.TRANSIENT, GmailErrorClassifier.classify(http(503)));
    }

    @Test
    void classify_RateLimited403_ShouldBeTransient() {
        assertEquals(ProviderResult.Outcome.TRANSIENT, GmailErrorClassifier.classify(json(403, "userRateLimitExceeded")));
        assertEquals(ProviderResult.Outcome.AUTH_FAILURE, GmailErrorClassifier.classify(json(403, "insufficientPermissions")));
    }

    @Test
    void classify_NetworkErrors_ShouldBeTransient() {
        assertEquals(ProviderResult.Outcome.TRANSIENT, GmailErrorClassifier.classify(new SocketTimeoutException("read timed out")));
        assertEquals(ProviderResult.Outcome.TRANSIENT, GmailErrorClassifier.classify(new IOException("connection reset")));
    }

    @Test
    void toResult_ShouldCarryDescription() {
        ProviderResult<Void> result = GmailErrorClassifier.toResult(json(404, "notFound"));

        assertTrue(result.isNotFound());
        assertEquals("404 notFound", result.getErrorMessage());
    }
}
