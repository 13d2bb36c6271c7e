package com.vcc.traingateway.service;

import com.vcc.traingateway.config.GwProperties;
import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.entity.TenantAccountMappingEntity;
import com.vcc.traingateway.entity.TenantEntity;
import com.vcc.traingateway.exception.ConfigurationException;
import com.vcc.traingateway.exception.OAuthRefreshException;
import com.vcc.traingateway.model.OAuthState;
import com.vcc.traingateway.model.RoutedAccount;
import com.vcc.traingateway.repository.AccountRepository;
import com.vcc.traingateway.repository.TenantAccountMappingRepository;
import com.vcc.traingateway.repository.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Selects the account that serves a tenant's request.
 * <p>
 * Candidates are the tenant's mapped accounts ordered by (priority, accountId), minus revoked,
 * inactive and invalid-grant accounts. A usable hint (explicit, else the tenant default) goes
 * first. Expiring OAuth tokens are refreshed before the account is returned. An invalid grant
 * skips to the next candidate; a transient refresh failure consumes one of the bounded failover
 * attempts. Nothing outside the tenant's mappings is ever substituted.
 */
@Service
public class AccountRouter {
    private static final Logger log = LoggerFactory.getLogger(AccountRouter.class);

    private static final Comparator<TenantAccountMappingEntity> MAPPING_ORDER =
            Comparator.comparingInt(TenantAccountMappingEntity::getPriority)
                    .thenComparing(TenantAccountMappingEntity::getAccountId);

    private final TenantRepository tenantRepository;
    private final TenantAccountMappingRepository mappingRepository;
    private final AccountRepository accountRepository;
    private final AccountService accountService;
    private final OAuthLifecycleManager lifecycleManager;
    private final ModelMapping modelMapping;
    private final int maxFailoverAttempts;

    public AccountRouter(TenantRepository tenantRepository,
                         TenantAccountMappingRepository mappingRepository,
                         AccountRepository accountRepository,
                         AccountService accountService,
                         OAuthLifecycleManager lifecycleManager,
                         ModelMapping modelMapping,
                         GwProperties properties) {
        this.tenantRepository = tenantRepository;
        this.mappingRepository = mappingRepository;
        this.accountRepository = accountRepository;
        this.accountService = accountService;
        this.lifecycleManager = lifecycleManager;
        this.modelMapping = modelMapping;
        this.maxFailoverAttempts = properties.getRouting().getMaxFailoverAttempts();
    }

    public Mono<RoutedAccount> selectAccount(String tenantId, String hint) {
        return selectAccount(tenantId, hint, null);
    }

    /**
     * @param hint         account the caller prefers, may be null
     * @param logicalModel model id from the request body, rewritten for the chosen provider
     * @throws ConfigurationException (as error signal) when no mapped account is usable
     */
    public Mono<RoutedAccount> selectAccount(String tenantId, String hint, String logicalModel) {
        return tenantRepository.findById(tenantId)
                .switchIfEmpty(Mono.error(ConfigurationException.noUsableAccount(tenantId)))
                .flatMap(tenant -> candidates(tenant, hint))
                .flatMap(candidates -> {
                    if (candidates.isEmpty()) {
                        log.warn("Tenant {} has no usable mapped account", tenantId);
                        return Mono.error(ConfigurationException.noUsableAccount(tenantId));
                    }
                    return attempt(tenantId, candidates, 0, maxFailoverAttempts, null);
                })
                .map(account -> new RoutedAccount(account, account.providerValue(),
                        modelMapping.toProviderModel(account.providerValue(), logicalModel)))
                .doOnNext(routed -> {
                    log.debug("Routed tenant {} to account {} (provider={}, model={})", tenantId,
                            routed.account().getAccountId(), routed.provider().dbValue(), routed.upstreamModel());
                    recordUse(routed.account().getAccountId());
                });
    }

    /**
     * Surviving accounts in routing order, hint first when it survives.
     */
    Mono<List<AccountEntity>> candidates(TenantEntity tenant, String hint) {
        String tenantId = tenant.getTenantId();
        return mappingRepository.findByTenantId(tenantId)
                .collectList()
                .flatMap(mappings -> {
                    if (mappings.isEmpty()) {
                        return Mono.just(List.<AccountEntity>of());
                    }
                    List<String> ids = mappings.stream()
                            .map(TenantAccountMappingEntity::getAccountId)
                            .collect(Collectors.toList());
                    return accountRepository.findAllById(ids)
                            .collectMap(AccountEntity::getAccountId, Function.identity())
                            .map(accounts -> order(tenantId, mappings, accounts, effectiveHint(tenant, hint)));
                });
    }

    private List<AccountEntity> order(String tenantId, List<TenantAccountMappingEntity> mappings,
                                      Map<String, AccountEntity> accounts, String hint) {
        List<AccountEntity> surviving = new ArrayList<>();
        mappings.stream()
                .sorted(MAPPING_ORDER)
                .forEach(mapping -> {
                    AccountEntity account = accounts.get(mapping.getAccountId());
                    if (account == null) {
                        log.warn("Tenant {} maps missing account {}", tenantId, mapping.getAccountId());
                    } else if (isUsable(account)) {
                        surviving.add(account);
                    }
                });

        if (hint != null) {
            Optional<AccountEntity> preferred = surviving.stream()
                    .filter(account -> account.getAccountId().equals(hint))
                    .findFirst();
            if (preferred.isPresent()) {
                surviving.remove(preferred.get());
                surviving.add(0, preferred.get());
            } else {
                log.debug("Hint {} is not a usable account of tenant {}, using priority order", hint, tenantId);
            }
        }
        return surviving;
    }

    private boolean isUsable(AccountEntity account) {
        return account.isActive()
                && !account.isRevoked()
                && lifecycleManager.stateOf(account) != OAuthState.INVALID_GRANT;
    }

    private static String effectiveHint(TenantEntity tenant, String hint) {
        if (hint != null && !hint.isBlank()) {
            return hint;
        }
        // Weak reference: only honoured if it survives the same filter as any other candidate
        return tenant.getDefaultAccountId();
    }

    private Mono<AccountEntity> attempt(String tenantId, List<AccountEntity> candidates, int index,
                                        int failoversLeft, OAuthRefreshException lastTransient) {
        if (index >= candidates.size()) {
            if (lastTransient != null) {
                return Mono.error(lastTransient);
            }
            return Mono.error(ConfigurationException.noUsableAccount(tenantId));
        }
        AccountEntity candidate = candidates.get(index);
        return lifecycleManager.ensureFresh(candidate)
                .onErrorResume(OAuthRefreshException.class, e -> {
                    if (e.getKind() == OAuthRefreshException.Kind.INVALID_GRANT) {
                        log.warn("Account {} has an invalid grant, skipping for tenant {}",
                                candidate.getAccountId(), tenantId);
                        return attempt(tenantId, candidates, index + 1, failoversLeft, lastTransient);
                    }
                    if (failoversLeft <= 0) {
                        return Mono.error(e);
                    }
                    log.warn("Refresh of account {} failed transiently, failing over for tenant {}",
                            candidate.getAccountId(), tenantId);
                    return attempt(tenantId, candidates, index + 1, failoversLeft - 1, e);
                });
    }

    private void recordUse(String accountId) {
        Mono.defer(() -> accountService.touchLastUsed(accountId)).subscribe();
    }
}
