package com.example.requestcache.web;

import jakarta.servlet.http.HttpServletRequest;
import java.security.Principal;

/**
 * Supplies the actor identity that separates per-user cache entries.
 */
@FunctionalInterface
public interface ActorResolver {

    String ANONYMOUS = "anonymous";

    String resolve(HttpServletRequest request);

    static ActorResolver principalOrAnonymous() {
        return request -> {
            Principal principal = request.getUserPrincipal();
            if (principal == null || principal.getName() == null || principal.getName().isBlank()) {
                return ANONYMOUS;
            }
            return principal.getName();
        };
    }
}
