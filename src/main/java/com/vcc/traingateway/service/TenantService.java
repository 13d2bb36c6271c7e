package com.vcc.traingateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.dto.CreateTenantRequest;
import com.vcc.traingateway.dto.MappingRequest;
import com.vcc.traingateway.dto.MappingResponse;
import com.vcc.traingateway.dto.TenantResponse;
import com.vcc.traingateway.dto.UpdateTenantRequest;
import com.vcc.traingateway.entity.TenantAccountMappingEntity;
import com.vcc.traingateway.entity.TenantEntity;
import com.vcc.traingateway.exception.DuplicateResourceException;
import com.vcc.traingateway.exception.ResourceNotFoundException;
import com.vcc.traingateway.repository.AccountRepository;
import com.vcc.traingateway.repository.TenantAccountMappingRepository;
import com.vcc.traingateway.repository.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Tenant ("train") management and tenant to account mappings.
 */
@Service
public class TenantService {
    private static final Logger log = LoggerFactory.getLogger(TenantService.class);

    private final TenantRepository tenantRepository;
    private final TenantAccountMappingRepository mappingRepository;
    private final AccountRepository accountRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TenantService(TenantRepository tenantRepository,
                         TenantAccountMappingRepository mappingRepository,
                         AccountRepository accountRepository,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this.tenantRepository = tenantRepository;
        this.mappingRepository = mappingRepository;
        this.accountRepository = accountRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ==================== Tenant Operations ====================

    /**
     * Create a new tenant. Tenants start with no mapped accounts.
     */
    @Transactional
    public Mono<TenantResponse> createTenant(CreateTenantRequest request) {
        String tenantId = request.tenantId();

        return tenantRepository.existsById(tenantId)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateResourceException("Tenant already exists: " + tenantId));
                    }
                    Instant now = clock.instant();
                    TenantEntity tenant = new TenantEntity();
                    tenant.setTenantId(tenantId);
                    tenant.setDescription(request.description());
                    tenant.setDefaultAccountId(blankToNull(request.defaultAccountId()));
                    tenant.setActive(true);
                    tenant.setNotificationConfig(writeJson(request.notificationConfig()));
                    tenant.setCreatedAt(now);
                    tenant.setUpdatedAt(now);
                    return tenantRepository.save(tenant.markNew());
                })
                .doOnSuccess(saved -> log.info("Created tenant {}", tenantId))
                .map(this::toResponse);
    }

    public Mono<TenantResponse> getTenant(String tenantId) {
        return findTenant(tenantId).map(this::toResponse);
    }

    public Flux<TenantResponse> listTenants() {
        return tenantRepository.findAllOrdered().map(this::toResponse);
    }

    /**
     * Partial update. The default account is stored as a weak reference and re-validated by
     * the router on every use, so it is not required to be mapped here.
     */
    @Transactional
    public Mono<TenantResponse> updateTenant(String tenantId, UpdateTenantRequest request) {
        return findTenant(tenantId)
                .flatMap(tenant -> {
                    if (request.description() != null) {
                        tenant.setDescription(request.description());
                    }
                    if (request.defaultAccountId() != null) {
                        tenant.setDefaultAccountId(blankToNull(request.defaultAccountId()));
                    }
                    if (request.active() != null) {
                        tenant.setActive(request.active());
                    }
                    if (request.notificationConfig() != null) {
                        tenant.setNotificationConfig(writeJson(request.notificationConfig()));
                    }
                    tenant.setUpdatedAt(clock.instant());
                    return tenantRepository.save(tenant);
                })
                .doOnSuccess(saved -> log.info("Updated tenant {} (active={})", tenantId, saved.isActive()))
                .map(this::toResponse);
    }

    // ==================== Mapping Operations ====================

    /**
     * Map an account to a tenant, or update the priority of an existing mapping.
     */
    @Transactional
    public Mono<MappingResponse> upsertMapping(String tenantId, MappingRequest request) {
        String accountId = request.accountId();
        int priority = request.effectivePriority();

        return findTenant(tenantId)
                .then(accountRepository.existsById(accountId))
                .flatMap(exists -> exists
                        ? mappingRepository.findByTenantIdAndAccountId(tenantId, accountId)
                        : Mono.error(new ResourceNotFoundException("Account", accountId)))
                .flatMap(existing -> {
                    existing.setPriority(priority);
                    return mappingRepository.save(existing);
                })
                .switchIfEmpty(Mono.defer(() -> {
                    TenantAccountMappingEntity mapping = new TenantAccountMappingEntity();
                    mapping.setTenantId(tenantId);
                    mapping.setAccountId(accountId);
                    mapping.setPriority(priority);
                    mapping.setCreatedAt(clock.instant());
                    return mappingRepository.save(mapping);
                }))
                .doOnSuccess(saved -> log.info("Mapped account {} to tenant {} (priority={})",
                        accountId, tenantId, priority))
                .map(MappingResponse::fromEntity);
    }

    public Flux<MappingResponse> listMappings(String tenantId) {
        return findTenant(tenantId)
                .thenMany(mappingRepository.findByTenantId(tenantId))
                .map(MappingResponse::fromEntity);
    }

    @Transactional
    public Mono<Void> removeMapping(String tenantId, String accountId) {
        return mappingRepository.deleteByTenantIdAndAccountId(tenantId, accountId)
                .flatMap(rows -> {
                    if (rows == 0) {
                        return Mono.error(new ResourceNotFoundException("Mapping", tenantId + "/" + accountId));
                    }
                    log.info("Unmapped account {} from tenant {}", accountId, tenantId);
                    return Mono.<Void>empty();
                });
    }

    // ==================== Helper Methods ====================

    private Mono<TenantEntity> findTenant(String tenantId) {
        return tenantRepository.findById(tenantId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Tenant", tenantId)));
    }

    private TenantResponse toResponse(TenantEntity tenant) {
        return new TenantResponse(
                tenant.getTenantId(),
                tenant.getDescription(),
                tenant.getDefaultAccountId(),
                tenant.isActive(),
                readJson(tenant.getNotificationConfig()),
                tenant.getCreatedAt(),
                tenant.getUpdatedAt()
        );
    }

    private String writeJson(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid notification config", e);
        }
    }

    private JsonNode readJson(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Stored notification config is not valid JSON: {}", e.getMessage());
            return null;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
