package com.vcc.traingateway.web;

import com.vcc.traingateway.dto.AccountView;
import com.vcc.traingateway.dto.ClientKeyView;
import com.vcc.traingateway.dto.CreateAccountRequest;
import com.vcc.traingateway.dto.CreateClientKeyRequest;
import com.vcc.traingateway.dto.CreateClientKeyResponse;
import com.vcc.traingateway.dto.CreateTenantRequest;
import com.vcc.traingateway.dto.GenerateAccountRequest;
import com.vcc.traingateway.dto.GenerateAccountResponse;
import com.vcc.traingateway.dto.ImportResult;
import com.vcc.traingateway.dto.MappingRequest;
import com.vcc.traingateway.dto.MappingResponse;
import com.vcc.traingateway.dto.OAuthStatusResponse;
import com.vcc.traingateway.dto.OAuthTokensRequest;
import com.vcc.traingateway.dto.RenameClientKeyRequest;
import com.vcc.traingateway.dto.RevokeClientKeyResponse;
import com.vcc.traingateway.dto.TenantResponse;
import com.vcc.traingateway.dto.UpdateAccountRequest;
import com.vcc.traingateway.dto.UpdateTenantRequest;
import com.vcc.traingateway.entity.AdminAuditLogEntity;
import com.vcc.traingateway.service.AccountService;
import com.vcc.traingateway.service.AuditService;
import com.vcc.traingateway.service.ClientKeyService;
import com.vcc.traingateway.service.CredentialImportService;
import com.vcc.traingateway.service.OAuthLifecycleManager;
import com.vcc.traingateway.service.TenantService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.util.HashMap;
import java.util.Map;

/**
 * Management API for accounts, tenants, mappings and client keys.
 * Protected by AdminSecurityFilter via X-Admin-Api-Key header.
 */
@RestController
@RequestMapping("/admin")
public class AdminController {
    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final AccountService accountService;
    private final OAuthLifecycleManager lifecycleManager;
    private final TenantService tenantService;
    private final ClientKeyService clientKeyService;
    private final CredentialImportService importService;
    private final AuditService auditService;

    public AdminController(AccountService accountService,
                           OAuthLifecycleManager lifecycleManager,
                           TenantService tenantService,
                           ClientKeyService clientKeyService,
                           CredentialImportService importService,
                           AuditService auditService) {
        this.accountService = accountService;
        this.lifecycleManager = lifecycleManager;
        this.tenantService = tenantService;
        this.clientKeyService = clientKeyService;
        this.importService = importService;
        this.auditService = auditService;
    }

    // ==================== Account Endpoints ====================

    /**
     * Create an account from an existing API key or OAuth token pair.
     * POST /admin/accounts
     */
    @PostMapping("/accounts")
    public Mono<ResponseEntity<AccountView>> createAccount(
            @Valid @RequestBody CreateAccountRequest request,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return accountService.createAccount(request)
                .flatMap(view -> auditService.logAccountAction(actor, AuditService.ACTION_CREATE_ACCOUNT,
                                view.accountId(), accountDetails(view), clientIp)
                        .thenReturn(view))
                .map(view -> ResponseEntity.status(HttpStatus.CREATED).body(view));
    }

    /**
     * Mint a new API key account. The plaintext key is returned once.
     * POST /admin/accounts/generate
     */
    @PostMapping("/accounts/generate")
    public Mono<ResponseEntity<GenerateAccountResponse>> generateAccount(
            @Valid @RequestBody GenerateAccountRequest request,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return accountService.generateAccount(request)
                .flatMap(response -> auditService.logAccountAction(actor, AuditService.ACTION_GENERATE_ACCOUNT,
                                response.account().accountId(), accountDetails(response.account()), clientIp)
                        .thenReturn(response))
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    @GetMapping("/accounts")
    public Flux<AccountView> listAccounts() {
        return accountService.listAccounts();
    }

    @GetMapping("/accounts/{accountId}")
    public Mono<AccountView> getAccount(@PathVariable String accountId) {
        return accountService.getAccountView(accountId);
    }

    @PatchMapping("/accounts/{accountId}")
    public Mono<AccountView> updateAccount(
            @PathVariable String accountId,
            @Valid @RequestBody UpdateAccountRequest request,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return accountService.updateAccount(accountId, request)
                .flatMap(view -> {
                    Map<String, Object> changes = new HashMap<>();
                    changes.put("credentialReplaced", request.replacesCredential());
                    if (request.accountName() != null) {
                        changes.put("accountName", request.accountName());
                    }
                    if (request.active() != null) {
                        changes.put("active", request.active());
                    }
                    if (request.provider() != null) {
                        changes.put("provider", request.provider());
                    }
                    return auditService.logAccountAction(actor, AuditService.ACTION_UPDATE_ACCOUNT,
                            accountId, changes, clientIp).thenReturn(view);
                });
    }

    /**
     * Soft revoke. The account is excluded from routing permanently.
     * POST /admin/accounts/{accountId}/revoke
     */
    @PostMapping("/accounts/{accountId}/revoke")
    public Mono<AccountView> revokeAccount(@PathVariable String accountId, ServerWebExchange exchange) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return accountService.revokeAccount(accountId)
                .flatMap(view -> auditService.logAccountAction(actor, AuditService.ACTION_REVOKE_ACCOUNT,
                        accountId, null, clientIp).thenReturn(view))
                .doOnSuccess(v -> log.info("Revoked account {} by {}", accountId, actor));
    }

    @DeleteMapping("/accounts/{accountId}")
    public Mono<ResponseEntity<Void>> deleteAccount(@PathVariable String accountId, ServerWebExchange exchange) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return accountService.deleteAccount(accountId)
                .then(auditService.logAccountAction(actor, AuditService.ACTION_DELETE_ACCOUNT,
                        accountId, null, clientIp))
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    /**
     * Replace OAuth tokens out-of-band, clearing an invalid_grant state.
     * PUT /admin/accounts/{accountId}/oauth
     */
    @PutMapping("/accounts/{accountId}/oauth")
    public Mono<AccountView> reauthenticate(
            @PathVariable String accountId,
            @Valid @RequestBody OAuthTokensRequest tokens,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return accountService.reauthenticate(accountId, tokens)
                .flatMap(view -> auditService.logAccountAction(actor, AuditService.ACTION_REAUTH_ACCOUNT,
                        accountId, null, clientIp).thenReturn(view));
    }

    @GetMapping("/accounts/{accountId}/oauth")
    public Mono<OAuthStatusResponse> getOAuthStatus(@PathVariable String accountId) {
        return lifecycleManager.status(accountId);
    }

    /**
     * Force a token refresh now, even if the current token is still valid.
     * POST /admin/accounts/{accountId}/oauth/refresh
     */
    @PostMapping("/accounts/{accountId}/oauth/refresh")
    public Mono<OAuthStatusResponse> refreshOAuth(@PathVariable String accountId, ServerWebExchange exchange) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return lifecycleManager.forceRefresh(accountId)
                .then(auditService.logAccountAction(actor, AuditService.ACTION_REFRESH_OAUTH,
                        accountId, null, clientIp))
                .then(lifecycleManager.status(accountId));
    }

    /**
     * Import credential files from the configured directory.
     * POST /admin/accounts/import
     */
    @PostMapping("/accounts/import")
    public Mono<ImportResult> importCredentials(ServerWebExchange exchange) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return importService.importConfigured()
                .flatMap(result -> {
                    Map<String, Object> details = new HashMap<>();
                    details.put("created", result.created());
                    details.put("updated", result.updated());
                    details.put("failed", result.failed());
                    return auditService.logAction(actor, AuditService.ACTION_IMPORT_CREDENTIALS,
                            AuditService.TARGET_ACCOUNT, "*", details, clientIp).thenReturn(result);
                });
    }

    // ==================== Tenant Endpoints ====================

    @PostMapping("/tenants")
    public Mono<ResponseEntity<TenantResponse>> createTenant(
            @Valid @RequestBody CreateTenantRequest request,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return tenantService.createTenant(request)
                .flatMap(response -> auditService.logTenantAction(actor, AuditService.ACTION_CREATE_TENANT,
                        response.tenantId(), null, clientIp).thenReturn(response))
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response))
                .doOnSuccess(r -> log.info("Created tenant {} by {}", request.tenantId(), actor));
    }

    @GetMapping("/tenants")
    public Flux<TenantResponse> listTenants() {
        return tenantService.listTenants();
    }

    @GetMapping("/tenants/{tenantId}")
    public Mono<TenantResponse> getTenant(@PathVariable String tenantId) {
        return tenantService.getTenant(tenantId);
    }

    @PatchMapping("/tenants/{tenantId}")
    public Mono<TenantResponse> updateTenant(
            @PathVariable String tenantId,
            @Valid @RequestBody UpdateTenantRequest request,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return tenantService.updateTenant(tenantId, request)
                .flatMap(response -> {
                    Map<String, Object> changes = new HashMap<>();
                    if (request.active() != null) {
                        changes.put("active", request.active());
                    }
                    if (request.defaultAccountId() != null) {
                        changes.put("defaultAccountId", request.defaultAccountId());
                    }
                    return auditService.logTenantAction(actor, AuditService.ACTION_UPDATE_TENANT,
                            tenantId, changes, clientIp).thenReturn(response);
                });
    }

    // ==================== Mapping Endpoints ====================

    /**
     * Map an account to a tenant or change its priority.
     * PUT /admin/tenants/{tenantId}/accounts
     */
    @PutMapping("/tenants/{tenantId}/accounts")
    public Mono<MappingResponse> upsertMapping(
            @PathVariable String tenantId,
            @Valid @RequestBody MappingRequest request,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return tenantService.upsertMapping(tenantId, request)
                .flatMap(mapping -> auditService.logMappingAction(actor, AuditService.ACTION_UPSERT_MAPPING,
                        tenantId, request.accountId(), request.effectivePriority(), clientIp).thenReturn(mapping));
    }

    @GetMapping("/tenants/{tenantId}/accounts")
    public Flux<MappingResponse> listMappings(@PathVariable String tenantId) {
        return tenantService.listMappings(tenantId);
    }

    @DeleteMapping("/tenants/{tenantId}/accounts/{accountId}")
    public Mono<ResponseEntity<Void>> removeMapping(
            @PathVariable String tenantId,
            @PathVariable String accountId,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return tenantService.removeMapping(tenantId, accountId)
                .then(auditService.logMappingAction(actor, AuditService.ACTION_DELETE_MAPPING,
                        tenantId, accountId, null, clientIp))
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    // ==================== Client Key Endpoints ====================

    /**
     * Issue a client key for a tenant.
     * POST /admin/tenants/{tenantId}/keys
     */
    @PostMapping("/tenants/{tenantId}/keys")
    public Mono<ResponseEntity<CreateClientKeyResponse>> createClientKey(
            @PathVariable String tenantId,
            @Valid @RequestBody CreateClientKeyRequest request,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return clientKeyService.createClientKey(tenantId, request)
                .flatMap(response -> auditService.logClientKeyAction(actor, AuditService.ACTION_CREATE_CLIENT_KEY,
                                response.keyId(), response.tenantId(), response.keyPreview(), clientIp)
                        .thenReturn(response))
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response))
                .doOnSuccess(r -> log.info("Created client key for tenant {} by {}", tenantId, actor));
    }

    @GetMapping("/tenants/{tenantId}/keys")
    public Flux<ClientKeyView> listClientKeys(@PathVariable String tenantId) {
        return clientKeyService.listClientKeys(tenantId);
    }

    @PatchMapping("/tenants/{tenantId}/keys/{keyId}")
    public Mono<ClientKeyView> renameClientKey(
            @PathVariable String tenantId,
            @PathVariable String keyId,
            @Valid @RequestBody RenameClientKeyRequest request,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);

        return clientKeyService.renameClientKey(tenantId, keyId, request.label())
                .flatMap(view -> auditService.logClientKeyAction(actor, AuditService.ACTION_RENAME_CLIENT_KEY,
                        keyId, tenantId, view.keyPreview(), clientIp).thenReturn(view));
    }

    /**
     * Revoke a client key. Takes effect for the very next request.
     * POST /admin/tenants/{tenantId}/keys/{keyId}/revoke
     */
    @PostMapping("/tenants/{tenantId}/keys/{keyId}/revoke")
    public Mono<RevokeClientKeyResponse> revokeClientKey(
            @PathVariable String tenantId,
            @PathVariable String keyId,
            @RequestParam(required = false) String revokedBy,
            ServerWebExchange exchange
    ) {
        String actor = getAdminActor(exchange);
        String clientIp = getClientIp(exchange);
        String revoker = revokedBy != null && !revokedBy.isBlank() ? revokedBy : actor;

        return clientKeyService.revokeClientKey(tenantId, keyId, revoker)
                .flatMap(response -> auditService.logClientKeyAction(actor, AuditService.ACTION_REVOKE_CLIENT_KEY,
                        keyId, tenantId, response.keyPreview(), clientIp).thenReturn(response))
                .doOnSuccess(r -> log.info("Revoked client key {} by {}", keyId, actor));
    }

    // ==================== Audit Endpoints ====================

    @GetMapping("/audit")
    public Flux<AdminAuditLogEntity> getAuditLogs(
            @RequestParam(required = false) String targetType,
            @RequestParam(required = false) String targetId,
            @RequestParam(defaultValue = "100") int limit
    ) {
        if (targetType != null && targetId != null) {
            return auditService.getLogsForTarget(targetType, targetId);
        }
        return auditService.getRecentLogs(limit);
    }

    // ==================== Helper Methods ====================

    private static Map<String, Object> accountDetails(AccountView view) {
        Map<String, Object> details = new HashMap<>();
        details.put("accountName", view.accountName());
        details.put("credentialType", view.credentialType());
        details.put("provider", view.provider());
        return details;
    }

    /**
     * Get admin actor from exchange attribute (set by AdminSecurityFilter).
     */
    private String getAdminActor(ServerWebExchange exchange) {
        Object actor = exchange.getAttribute(AdminSecurityFilter.ADMIN_ACTOR_ATTR);
        return actor != null ? actor.toString() : "unknown";
    }

    /**
     * Get client IP address from exchange.
     */
    private String getClientIp(ServerWebExchange exchange) {
        // Check for proxy headers
        String forwardedFor = exchange.getRequest().getHeaders().getFirst("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }

        String realIp = exchange.getRequest().getHeaders().getFirst("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp;
        }

        InetSocketAddress remoteAddress = exchange.getRequest().getRemoteAddress();
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }

        return "unknown";
    }
}
