package jump.email.watch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jump.email.watch.entity.CredentialStatus;
import jump.email.watch.entity.GmailAccount;
import jump.email.watch.entity.OAuthToken;
import jump.email.watch.exception.CredentialException;
import jump.email.watch.model.MailboxHandle;
import jump.email.watch.repository.GmailAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Hands out Gmail access tokens stored at sign-in, refreshing them against Google's token
 * endpoint when they expire within five minutes.
 */
@Slf4j
@Service
public class OAuthCredentialProvider implements CredentialProvider {
    static final String TOKEN_ENDPOINT = "https://oauth2.googleapis.com/token";
    private static final Duration REFRESH_MARGIN = Duration.ofMinutes(5);

    private final OAuthTokenService oauthTokenService;
    private final GmailAccountRepository gmailAccountRepository;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${spring.security.oauth2.client.registration.google.client-id:}")
    private String clientId;

    @Value("${spring.security.oauth2.client.registration.google.client-secret:}")
    private String clientSecret;

    public OAuthCredentialProvider(OAuthTokenService oauthTokenService,
                                   GmailAccountRepository gmailAccountRepository,
                                   RestTemplate restTemplate,
                                   ObjectMapper objectMapper,
                                   Clock clock) {
        this.oauthTokenService = oauthTokenService;
        this.gmailAccountRepository = gmailAccountRepository;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    @Transactional
    public MailboxHandle getAuthenticatedHandle(String principalId) {
        GmailAccount account = oauthTokenService.getPrimaryGmailAccount(principalId)
            .orElseThrow(() -> new CredentialException(principalId, "No Gmail account connected for principal " + principalId));

        OAuthToken token = account.getToken();
        if (token == null || token.getAccessToken() == null) {
            throw new CredentialException(principalId, "No access token available for account: " + account.getEmailAddress());
        }

        if (token.expiresWithin(clock.instant(), REFRESH_MARGIN)) {
            if (!token.hasRefreshToken()) {
                markStatus(account, CredentialStatus.EXPIRED);
                throw new CredentialException(principalId,
                    "Access token expired and no refresh token available for account: " + account.getEmailAddress() + ". Please re-authenticate.");
            }
            try {
                log.info("Refreshing access token for account: {}", account.getEmailAddress());
                refreshAccessToken(account);
            } catch (CredentialException e) {
                markStatus(account, CredentialStatus.ERROR);
                log.error("Failed to refresh access token for account {}: {}", account.getEmailAddress(), e.getMessage(), e);
                throw e;
            }
        }

        return new MailboxHandle(principalId, account.getEmailAddress(), account.getToken().getAccessToken());
    }

    void refreshAccessToken(GmailAccount account) {
        String principalId = account.getUser() != null ? account.getUser().getId() : null;
        if (clientId == null || clientId.isEmpty() || clientSecret == null || clientSecret.isEmpty()) {
            throw new CredentialException(principalId, "Google OAuth client credentials are not configured");
        }
        OAuthToken token = account.getToken();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("client_id", clientId);
        body.add("client_secret", clientSecret);
        body.add("refresh_token", token.getRefreshToken());
        body.add("grant_type", "refresh_token");

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(TOKEN_ENDPOINT, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            throw new CredentialException(principalId, "Error refreshing access token: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new CredentialException(principalId, "Failed to refresh token. Status: " + response.getStatusCode());
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(response.getBody());
        } catch (IOException e) {
            throw new CredentialException(principalId, "Unreadable token refresh response", e);
        }
        if (!json.hasNonNull("access_token")) {
            throw new CredentialException(principalId, "Token refresh response missing access_token");
        }

        long expiresInSeconds = json.has("expires_in") ? json.get("expires_in").asLong() : 3600;
        Instant expiry = clock.instant().plusSeconds(expiresInSeconds);
        token.setAccessToken(json.get("access_token").asText());
        token.setExpiry(expiry);
        if (json.hasNonNull("refresh_token")) {
            token.setRefreshToken(json.get("refresh_token").asText());
        }

        account.setToken(token);
        account.setCredentialStatus(CredentialStatus.ACTIVE);
        gmailAccountRepository.save(account);
        log.info("Token refreshed for account: {}, expires at: {}", account.getEmailAddress(), expiry);
    }

    private void markStatus(GmailAccount account, CredentialStatus status) {
        account.setCredentialStatus(status);
        gmailAccountRepository.save(account);
    }
}
