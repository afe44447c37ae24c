package jump.email.watch.service;

import jump.email.watch.entity.CredentialStatus;
import jump.email.watch.entity.GmailAccount;
import jump.email.watch.entity.OAuthToken;
import jump.email.watch.entity.User;
import jump.email.watch.repository.GmailAccountRepository;
import jump.email.watch.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.core.OAuth2AccessToken;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Maps signed-in Google users to principals and stores the tokens they granted.
 */
@Slf4j
@Service
public class OAuthTokenService {
    private final UserRepository userRepository;
    private final GmailAccountRepository gmailAccountRepository;

    public OAuthTokenService(UserRepository userRepository, GmailAccountRepository gmailAccountRepository) {
        this.userRepository = userRepository;
        this.gmailAccountRepository = gmailAccountRepository;
    }

    @Transactional
    public User getOrCreateUser(Authentication authentication) {
        OAuth2User oauth2User = (OAuth2User) authentication.getPrincipal();
        String userId = oauth2User.getName();
        String email = oauth2User.getAttribute("email");

        Optional<User> existingUser = userRepository.findById(userId);
        if (existingUser.isPresent()) {
            User user = existingUser.get();
            if (email != null && !email.equals(user.getPrimaryEmail())) {
                user.setPrimaryEmail(email);
                userRepository.save(user);
            }
            return user;
        }
        User user = new User();
        user.setId(userId);
        user.setPrimaryEmail(email);
        log.info("Registered principal {} ({})", userId, email);
        return userRepository.save(user);
    }

    @Transactional
    public GmailAccount storeAccessToken(User user, OAuth2AccessToken accessToken, String refreshToken,
                                         String email, String scopes) {
        Optional<GmailAccount> existingAccount = gmailAccountRepository.findByUserAndEmailAddress(user, email);

        GmailAccount gmailAccount;
        if (existingAccount.isPresent()) {
            gmailAccount = existingAccount.get();
        } else {
            gmailAccount = new GmailAccount();
            gmailAccount.setUser(user);
            gmailAccount.setEmailAddress(email);
            gmailAccount.setPrimaryAccount(user.getGmailAccounts().isEmpty());
            user.getGmailAccounts().add(gmailAccount);
        }

        OAuthToken token = new OAuthToken();
        token.setAccessToken(accessToken.getTokenValue());
        // Google omits the refresh token on repeat consent; keep the one we have
        if (refreshToken == null && gmailAccount.getToken() != null) {
            refreshToken = gmailAccount.getToken().getRefreshToken();
        }
        token.setRefreshToken(refreshToken);
        token.setExpiry(accessToken.getExpiresAt());
        token.setScopes(scopes);

        gmailAccount.setToken(token);
        gmailAccount.setCredentialStatus(CredentialStatus.ACTIVE);

        return gmailAccountRepository.save(gmailAccount);
    }

    /**
     * The primary mailbox of a principal, falling back to the first connected one.
     */
    public Optional<GmailAccount> getPrimaryGmailAccount(String principalId) {
        Optional<GmailAccount> primary = gmailAccountRepository.findByUserIdAndPrimaryAccountTrue(principalId);
        if (primary.isPresent()) {
            return primary;
        }
        List<GmailAccount> accounts = gmailAccountRepository.findByUserId(principalId);
        return accounts.isEmpty() ? Optional.empty() : Optional.of(accounts.get(0));
    }
}
