package com.example.requestcache.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Set;

/**
 * Decides whether a captured response may be stored. Evaluated after the downstream handler ran.
 */
@FunctionalInterface
public interface ResponseCachePredicate {

    Set<String> READ_ONLY_METHODS = Set.of("GET", "HEAD");

    boolean shouldCache(HttpServletRequest request, HttpServletResponse response);

    /** Read-only method and a 2xx status. */
    static ResponseCachePredicate readOnlySuccess() {
        return (request, response) -> READ_ONLY_METHODS.contains(request.getMethod())
            && response.getStatus() >= 200
            && response.getStatus() < 300;
    }
}
