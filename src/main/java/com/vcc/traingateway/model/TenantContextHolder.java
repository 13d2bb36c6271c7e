package com.vcc.traingateway.model;

import reactor.core.publisher.Mono;
import reactor.util.context.Context;

/**
 * Reactor context and exchange attribute keys carrying the authenticated {@link TenantContext}.
 */
public final class TenantContextHolder {

    public static final String TENANT_CTX = TenantContextHolder.class.getName() + ".TENANT";
    public static final String TENANT_ATTR = "gw.tenantContext";

    private TenantContextHolder() {
    }

    public static Context withTenant(TenantContext tenant) {
        return Context.of(TENANT_CTX, tenant);
    }

    /**
     * Current tenant, empty when the request was not authenticated.
     */
    public static Mono<TenantContext> current() {
        return Mono.deferContextual(ctx -> ctx.hasKey(TENANT_CTX)
                ? Mono.just(ctx.<TenantContext>get(TENANT_CTX))
                : Mono.empty());
    }
}
