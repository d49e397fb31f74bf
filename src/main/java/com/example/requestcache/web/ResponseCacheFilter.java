package com.example.requestcache.web;

import com.example.requestcache.core.CacheStore;
import com.example.requestcache.key.CacheKeyParts;
import com.example.requestcache.key.CacheKeys;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.MultiValueMap;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.WebUtils;

/**
 * Request-boundary response cache.
 *
 * <p>For requests matching a {@link CacheRoute}:
 *
 * <ol>
 *   <li>derive a key from method, path, query parameters and actor
 *   <li>on a hit, replay the stored {@link ResponseSnapshot} without calling the rest of the chain
 *   <li>on a miss, run the chain against a buffering wrapper and store the snapshot when the
 *       {@link ResponseCachePredicate} accepts it
 * </ol>
 *
 * <p>Only {@code GET} and {@code HEAD} requests are looked up; other methods pass through without
 * touching the store. When the handler completes asynchronously, capture is deferred to the async
 * dispatch so the stored snapshot holds the final status and body.
 *
 * <p>Cache faults never fail the request: a key or snapshot problem is logged and the request is
 * served as an uncached miss. Exceptions from the downstream chain propagate unchanged.
 */
@Slf4j
@RequiredArgsConstructor
public class ResponseCacheFilter extends OncePerRequestFilter {

    public static final String KEY_KIND = "http";

    private static final AntPathMatcher PATHS = new AntPathMatcher();

    private static final String PENDING_CAPTURE_ATTRIBUTE = ResponseCacheFilter.class.getName() + ".PENDING_CAPTURE";

    private final CacheStore store;
    private final CacheKeys cacheKeys;
    private final List<CacheRoute> routes;
    private final ResponseCachePredicate predicate;
    private final ActorResolver actorResolver;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !ResponseCachePredicate.READ_ONLY_METHODS.contains(request.getMethod())
            || matchRoute(request).isEmpty();
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
        throws ServletException, IOException {

        if (isAsyncDispatch(request)) {
            continueAfterAsync(request, response, filterChain);
            return;
        }

        Optional<CacheRoute> route = matchRoute(request);
        Optional<String> key = route.flatMap(r -> deriveKey(request));
        if (key.isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        Optional<ResponseSnapshot> cached = lookup(key.get());
        if (cached.isPresent()) {
            log.debug("Response served from cache: key={}", key.get());
            cached.get().replay(response);
            return;
        }

        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        boolean completed = false;
        try {
            filterChain.doFilter(request, wrapper);
            completed = true;
        } finally {
            if (isAsyncStarted(request)) {
                request.setAttribute(PENDING_CAPTURE_ATTRIBUTE, new PendingCapture(key.get(), route.get()));
            } else {
                if (completed) {
                    capture(key.get(), route.get(), request, wrapper);
                }
                wrapper.copyBodyToResponse();
            }
        }
    }

    // the async dispatch reuses the response passed to startAsync, which wraps our buffer
    private void continueAfterAsync(
        HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
        throws ServletException, IOException {

        ContentCachingResponseWrapper wrapper =
            WebUtils.getNativeResponse(response, ContentCachingResponseWrapper.class);
        boolean completed = false;
        try {
            filterChain.doFilter(request, response);
            completed = true;
        } finally {
            if (wrapper != null && !isAsyncStarted(request)) {
                Object pending = request.getAttribute(PENDING_CAPTURE_ATTRIBUTE);
                request.removeAttribute(PENDING_CAPTURE_ATTRIBUTE);
                if (completed && pending instanceof PendingCapture deferred) {
                    capture(deferred.key(), deferred.route(), request, wrapper);
                }
                wrapper.copyBodyToResponse();
            }
        }
    }

    /** Key for a request; public so write paths can invalidate one exact response. */
    public String keyFor(HttpServletRequest request) {
        return cacheKeys.serialize(CacheKeyParts.of(
            KEY_KIND,
            request.getMethod(),
            request.getRequestURI(),
            sortedQueryParameters(request.getQueryString()),
            actorResolver.resolve(request)));
    }

    private Optional<CacheRoute> matchRoute(HttpServletRequest request) {
        String path = request.getRequestURI();
        for (CacheRoute route : routes) {
            if (PATHS.match(route.pattern(), path)) {
                return Optional.of(route);
            }
        }
        return Optional.empty();
    }

    private Optional<String> deriveKey(HttpServletRequest request) {
        try {
            return Optional.of(keyFor(request));
        } catch (RuntimeException e) {
            log.warn("Response cache key derivation failed, bypassing cache: uri={}", request.getRequestURI(), e);
            return Optional.empty();
        }
    }

    private Optional<ResponseSnapshot> lookup(String key) {
        try {
            return store.get(key, ResponseSnapshot.class);
        } catch (RuntimeException e) {
            log.warn("Response cache lookup failed, treating as miss: key={}", key, e);
            return Optional.empty();
        }
    }

    private void capture(
        String key, CacheRoute route, HttpServletRequest request, ContentCachingResponseWrapper response) {
        try {
            if (!predicate.shouldCache(request, response)) {
                log.debug("Response not cacheable: key={}, status={}", key, response.getStatus());
                return;
            }
            ResponseSnapshot snapshot = ResponseSnapshot.capture(response, response.getContentAsByteArray());
            store.set(key, snapshot, route.ttlMillis());
            log.debug("Response cached: key={}, ttl={}, bytes={}", key, route.ttlMillis(), response.getContentSize());
        } catch (RuntimeException e) {
            log.warn("Response snapshot failed, response delivered uncached: key={}", key, e);
        }
    }

    private static Map<String, List<String>> sortedQueryParameters(String queryString) {
        Map<String, List<String>> sorted = new TreeMap<>();
        if (queryString == null || queryString.isEmpty()) {
            return sorted;
        }
        MultiValueMap<String, String> parameters =
            UriComponentsBuilder.newInstance().query(queryString).build().getQueryParams();
        parameters.forEach(sorted::put);
        return sorted;
    }

    private record PendingCapture(String key, CacheRoute route) {
    }
}
