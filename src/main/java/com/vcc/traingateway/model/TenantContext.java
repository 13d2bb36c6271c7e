package com.vcc.traingateway.model;

/**
 * Authenticated tenant bound to a request by the client authentication filter.
 * Downstream code reads it from the Reactor context or the exchange, never from headers.
 */
public record TenantContext(String tenantId, String keyId) {
}
