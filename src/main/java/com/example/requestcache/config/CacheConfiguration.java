package com.example.requestcache.config;

import com.example.requestcache.core.CacheStore;
import com.example.requestcache.eviction.LruEvictionStrategy;
import com.example.requestcache.key.CacheKeys;
import com.example.requestcache.query.PageQueryFactory;
import com.example.requestcache.query.PaginatedQueryCache;
import com.example.requestcache.refresh.ReadThroughCache;
import com.example.requestcache.web.ActorResolver;
import com.example.requestcache.web.CacheRoute;
import com.example.requestcache.web.InvalidationRule;
import com.example.requestcache.web.ResponseCacheFilter;
import com.example.requestcache.web.ResponseCachePredicate;
import com.example.requestcache.web.WriteInvalidationFilter;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * Wires the single process-wide cache and its consumers.
 *
 * <p>Filter order: {@link WriteInvalidationFilter} wraps {@link ResponseCacheFilter}, both late in
 * the chain so security and request logging filters run first.
 */
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheConfiguration {

    static final int WRITE_INVALIDATION_ORDER = Ordered.LOWEST_PRECEDENCE - 20;
    static final int RESPONSE_CACHE_ORDER = Ordered.LOWEST_PRECEDENCE - 10;

    @Bean
    public CacheStore cacheStore(CacheProperties properties) {
        return new CacheStore(
            properties.getMaxSize(),
            properties.getDefaultTtl().toMillis(),
            new LruEvictionStrategy(),
            Clock.systemUTC());
    }

    @Bean
    public CacheKeys cacheKeys() {
        return new CacheKeys();
    }

    @Bean
    public ReadThroughCache readThroughCache(CacheStore cacheStore) {
        return new ReadThroughCache(cacheStore);
    }

    @Bean
    public PaginatedQueryCache paginatedQueryCache(
        ReadThroughCache readThroughCache, CacheKeys cacheKeys, CacheProperties properties) {
        return new PaginatedQueryCache(
            readThroughCache, cacheKeys, properties.getEntityTtl(), properties.getDefaultTtl().toMillis());
    }

    @Bean
    public PageQueryFactory pageQueryFactory(CacheProperties properties) {
        CacheProperties.Pagination pagination = properties.getPagination();
        return new PageQueryFactory(
            pagination.getDefaultLimit(),
            pagination.getMaxLimit(),
            pagination.getDefaultSort(),
            pagination.getDefaultOrder(),
            pagination.getAllowedSortFields(),
            pagination.getFilterFields());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseCachePredicate responseCachePredicate() {
        return ResponseCachePredicate.readOnlySuccess();
    }

    @Bean
    @ConditionalOnMissingBean
    public ActorResolver actorResolver() {
        return ActorResolver.principalOrAnonymous();
    }

    @Bean
    public FilterRegistrationBean<ResponseCacheFilter> responseCacheFilter(
        CacheStore cacheStore,
        CacheKeys cacheKeys,
        CacheProperties properties,
        ResponseCachePredicate responseCachePredicate,
        ActorResolver actorResolver) {
        List<CacheRoute> routes = properties.getRoutes().stream()
            .map(route -> new CacheRoute(route.getPattern(), route.resolveTtl()))
            .toList();
        ResponseCacheFilter filter =
            new ResponseCacheFilter(cacheStore, cacheKeys, routes, responseCachePredicate, actorResolver);

        FilterRegistrationBean<ResponseCacheFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setName("responseCacheFilter");
        registration.addUrlPatterns("/*");
        registration.setOrder(RESPONSE_CACHE_ORDER);
        return registration;
    }

    @Bean
    public FilterRegistrationBean<WriteInvalidationFilter> writeInvalidationFilter(
        CacheStore cacheStore, CacheProperties properties) {
        List<InvalidationRule> rules = properties.getInvalidation().stream()
            .map(rule -> new InvalidationRule(rule.getPattern(), new HashSet<>(rule.getMethods()), rule.getInvalidates()))
            .toList();

        FilterRegistrationBean<WriteInvalidationFilter> registration =
            new FilterRegistrationBean<>(new WriteInvalidationFilter(cacheStore, rules));
        registration.setName("writeInvalidationFilter");
        registration.addUrlPatterns("/*");
        registration.setOrder(WRITE_INVALIDATION_ORDER);
        return registration;
    }
}
