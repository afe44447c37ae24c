package jump.email.watch.config;

import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jump.email.watch.entity.User;
import jump.email.watch.service.OAuthTokenService;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClient;
import org.springframework.security.oauth2.client.OAuth2AuthorizedClientService;
import org.springframework.security.oauth2.client.authentication.OAuth2AuthenticationToken;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.security.web.authentication.SimpleUrlAuthenticationSuccessHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Persists the Google tokens after sign-in so watches can be created and renewed
 * without the user being present.
 */
@Component
public class OAuth2SuccessHandler extends SimpleUrlAuthenticationSuccessHandler {
    private final OAuth2AuthorizedClientService authorizedClientService;
    private final OAuthTokenService oauthTokenService;

    public OAuth2SuccessHandler(
            OAuth2AuthorizedClientService authorizedClientService,
            OAuthTokenService oauthTokenService) {
        this.authorizedClientService = authorizedClientService;
        this.oauthTokenService = oauthTokenService;
        setDefaultTargetUrl("/api/watch");
    }

    @Override
    public void onAuthenticationSuccess(HttpServletRequest request, HttpServletResponse response,
                                        Authentication authentication) throws IOException, ServletException {
        if (authentication instanceof OAuth2AuthenticationToken) {
            OAuth2AuthenticationToken oauthToken = (OAuth2AuthenticationToken) authentication;

            OAuth2AuthorizedClient client = authorizedClientService.loadAuthorizedClient(
                oauthToken.getAuthorizedClientRegistrationId(),
                oauthToken.getName()
            );

            if (client != null) {
                OAuth2User oauth2User = (OAuth2User) authentication.getPrincipal();
                String email = oauth2User.getAttribute("email");
                User user = oauthTokenService.getOrCreateUser(authentication);

                String scopes = client.getAccessToken().getScopes() != null
                    ? String.join(",", client.getAccessToken().getScopes())
                    : "";
                String refreshToken = client.getRefreshToken() != null
                    ? client.getRefreshToken().getTokenValue()
                    : null;
                oauthTokenService.storeAccessToken(user, client.getAccessToken(), refreshToken, email, scopes);
            }
        }

        super.onAuthenticationSuccess(request, response, authentication);
    }
}
