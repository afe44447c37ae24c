package jump.email.watch.controller;

import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.core.user.OAuth2User;

final class AuthenticatedPrincipal {
    private AuthenticatedPrincipal() {
    }

    static String id(Authentication authentication) {
        return authentication.getName();
    }

    static String email(Authentication authentication) {
        if (authentication.getPrincipal() instanceof OAuth2User) {
            return ((OAuth2User) authentication.getPrincipal()).getAttribute("email");
        }
        return null;
    }
}
