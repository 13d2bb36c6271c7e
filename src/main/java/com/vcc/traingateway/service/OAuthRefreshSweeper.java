package com.vcc.traingateway.service;

import com.vcc.traingateway.entity.AccountEntity;
import com.vcc.traingateway.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Background refresh of OAuth accounts that are expiring or expired, so requests rarely pay for
 * a refresh inline. Goes through the same single-flight path as request-time refreshes.
 */
@Component
@ConditionalOnProperty(prefix = "gw.oauth", name = "sweep-enabled", havingValue = "true")
public class OAuthRefreshSweeper {
    private static final Logger log = LoggerFactory.getLogger(OAuthRefreshSweeper.class);

    private static final int CONCURRENCY = 4;

    private final AccountRepository accountRepository;
    private final OAuthLifecycleManager lifecycleManager;
    private final OAuthStateEvaluator stateEvaluator;

    public OAuthRefreshSweeper(AccountRepository accountRepository,
                               OAuthLifecycleManager lifecycleManager,
                               OAuthStateEvaluator stateEvaluator) {
        this.accountRepository = accountRepository;
        this.lifecycleManager = lifecycleManager;
        this.stateEvaluator = stateEvaluator;
    }

    @Scheduled(fixedDelayString = "${gw.oauth.sweep-interval:PT5M}", initialDelayString = "PT30S")
    public void sweep() {
        sweepOnce().block(Duration.ofMinutes(5));
    }

    /**
     * @return number of accounts refreshed successfully
     */
    public Mono<Integer> sweepOnce() {
        long deadline = stateEvaluator.refreshDeadline();
        return accountRepository.findOAuthDueBefore(deadline)
                .filter(account -> !account.isInvalidGrant())
                .flatMap(this::refreshQuietly, CONCURRENCY)
                .reduce(0, (count, refreshed) -> refreshed ? count + 1 : count)
                .doOnNext(count -> {
                    if (count > 0) {
                        log.info("OAuth sweep refreshed {} accounts", count);
                    }
                })
                .onErrorResume(e -> {
                    log.warn("OAuth sweep failed: {}", e.getMessage());
                    return Mono.just(0);
                });
    }

    private Mono<Boolean> refreshQuietly(AccountEntity account) {
        return lifecycleManager.refresh(account.getAccountId())
                .map(refreshed -> true)
                .onErrorResume(e -> {
                    log.warn("OAuth sweep could not refresh account {} ({}): {}",
                            account.getAccountId(), account.getAccountName(), e.getMessage());
                    return Mono.just(false);
                });
    }
}
