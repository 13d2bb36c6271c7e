package com.vcc.traingateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.traingateway.entity.AdminAuditLogEntity;
import com.vcc.traingateway.repository.AdminAuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Map;

/**
 * Audit logging service for management operations.
 * Records every mutation with actor, target, and details. Details must never carry secrets.
 */
@Service
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    // Standard action types
    public static final String ACTION_CREATE_ACCOUNT = "CREATE_ACCOUNT";
    public static final String ACTION_GENERATE_ACCOUNT = "GENERATE_ACCOUNT";
    public static final String ACTION_UPDATE_ACCOUNT = "UPDATE_ACCOUNT";
    public static final String ACTION_REVOKE_ACCOUNT = "REVOKE_ACCOUNT";
    public static final String ACTION_DELETE_ACCOUNT = "DELETE_ACCOUNT";
    public static final String ACTION_REAUTH_ACCOUNT = "REAUTH_ACCOUNT";
    public static final String ACTION_REFRESH_OAUTH = "REFRESH_OAUTH";
    public static final String ACTION_IMPORT_CREDENTIALS = "IMPORT_CREDENTIALS";
    public static final String ACTION_CREATE_TENANT = "CREATE_TENANT";
    public static final String ACTION_UPDATE_TENANT = "UPDATE_TENANT";
    public static final String ACTION_CREATE_CLIENT_KEY = "CREATE_CLIENT_KEY";
    public static final String ACTION_RENAME_CLIENT_KEY = "RENAME_CLIENT_KEY";
    public static final String ACTION_REVOKE_CLIENT_KEY = "REVOKE_CLIENT_KEY";
    public static final String ACTION_UPSERT_MAPPING = "UPSERT_MAPPING";
    public static final String ACTION_DELETE_MAPPING = "DELETE_MAPPING";

    // Target types
    public static final String TARGET_ACCOUNT = "account";
    public static final String TARGET_TENANT = "tenant";
    public static final String TARGET_CLIENT_KEY = "client_key";
    public static final String TARGET_MAPPING = "mapping";

    private final AdminAuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditService(AdminAuditLogRepository auditLogRepository,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Log a management action.
     *
     * @param actor      The admin performing the action
     * @param action     The action type (e.g., CREATE_TENANT)
     * @param targetType The type of target (e.g., tenant, client_key)
     * @param targetId   The ID of the target
     * @param details    Additional details as key-value pairs
     * @param clientIp   Client IP address
     * @return The saved audit log entry
     */
    public Mono<AdminAuditLogEntity> logAction(
            String actor,
            String action,
            String targetType,
            String targetId,
            Map<String, ?> details,
            String clientIp
    ) {
        AdminAuditLogEntity entity = new AdminAuditLogEntity();
        entity.setActor(actor != null ? actor : "unknown");
        entity.setAction(action);
        entity.setTargetType(targetType);
        entity.setTargetId(targetId);
        entity.setClientIp(clientIp);
        entity.setCreatedAt(clock.instant());

        if (details != null && !details.isEmpty()) {
            try {
                entity.setDetailJson(objectMapper.writeValueAsString(details));
            } catch (JsonProcessingException e) {
                log.warn("Failed to serialize audit details: {}", e.getMessage());
                entity.setDetailJson("{}");
            }
        }

        return auditLogRepository.save(entity)
                .doOnSuccess(saved -> log.info("Audit: {} {} {} by {} from {}",
                        action, targetType, targetId, actor, clientIp))
                .doOnError(e -> log.error("Failed to save audit log: {}", e.getMessage()));
    }

    public Mono<AdminAuditLogEntity> logAccountAction(String actor, String action, String accountId,
                                                      Map<String, ?> details, String clientIp) {
        return logAction(actor, action, TARGET_ACCOUNT, accountId, details, clientIp);
    }

    public Mono<AdminAuditLogEntity> logTenantAction(String actor, String action, String tenantId,
                                                     Map<String, ?> details, String clientIp) {
        return logAction(actor, action, TARGET_TENANT, tenantId, details, clientIp);
    }

    public Mono<AdminAuditLogEntity> logClientKeyAction(String actor, String action, String keyId,
                                                        String tenantId, String keyPrefix, String clientIp) {
        return logAction(actor, action, TARGET_CLIENT_KEY, keyId,
                Map.of("tenantId", tenantId, "keyPrefix", keyPrefix), clientIp);
    }

    public Mono<AdminAuditLogEntity> logMappingAction(String actor, String action, String tenantId,
                                                      String accountId, Integer priority, String clientIp) {
        return logAction(actor, action, TARGET_MAPPING, tenantId + "/" + accountId,
                priority != null ? Map.of("priority", priority) : Map.of(), clientIp);
    }

    // ==================== Query Methods ====================

    /**
     * Get recent audit logs.
     */
    public Flux<AdminAuditLogEntity> getRecentLogs(int limit) {
        return auditLogRepository.findRecent(Math.max(1, Math.min(limit, 1000)));
    }

    /**
     * Get audit logs for a specific target.
     */
    public Flux<AdminAuditLogEntity> getLogsForTarget(String targetType, String targetId) {
        return auditLogRepository.findByTarget(targetType, targetId);
    }
}
