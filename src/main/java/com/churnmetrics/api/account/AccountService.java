package com.churnmetrics.api.account;

import com.churnmetrics.api.account.entities.AccountRepository;
import com.churnmetrics.api.contracts.AccountServiceContract;
import com.churnmetrics.api.platform.transaction.annotations.ReasonablyTransactional;
import com.churnmetrics.api.subscription.entities.SubscriptionRepository;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * {@link AccountService} implements operations related to merchant account attributes.
 */
@Service
@Slf4j
class AccountService implements AccountServiceContract {

    private final AccountConfiguration accountConfig;
    private final AccountRepository accountRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final Cache cache;
    private final Clock clock;

    @Autowired
    AccountService(
        @NonNull AccountConfiguration accountConfig,
        @NonNull AccountRepository accountRepository,
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull @Qualifier(AccountBeans.CACHE_NAME) Cache cache,
        @NonNull Clock clock
    ) {
        this.accountConfig = accountConfig;
        this.accountRepository = accountRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.cache = cache;
        this.clock = clock;
    }

    @NonNull
    @Override
    @Transactional(readOnly = true)
    @Cacheable(cacheNames = AccountBeans.CACHE_NAME, key = "'timeZone:' + #accountId")
    public Optional<ZoneId> findTimeZone(@NonNull Long accountId) {
        return accountRepository.findById(accountId)
            .map(account -> ZoneId.of(account.getTimeZone()));
    }

    @Override
    @Transactional(readOnly = true)
    @Cacheable(cacheNames = AccountBeans.CACHE_NAME, key = "'isLarge:' + #accountId")
    public boolean isLargeAccount(@NonNull Long accountId) {
        return accountRepository.findById(accountId)
            .map(account -> account.isLarge())
            .orElse(false);
    }

    /**
     * Promotes the account to a large account once the number of its subscriptions reaches
     * {@link AccountConfiguration#getLargeAccountSubscriptionThreshold()}. Accounts are never
     * demoted.
     *
     * @param accountId id of the account.
     */
    @Override
    @ReasonablyTransactional
    public void markLargeIfWarranted(@NonNull Long accountId) {
        val account = accountRepository.findById(accountId).orElse(null);
        if (account == null || account.isLarge()) {
            return;
        }

        val subscriptionCount = subscriptionRepository.countByAccountId(accountId);
        if (subscriptionCount < accountConfig.getLargeAccountSubscriptionThreshold()) {
            return;
        }

        if (accountRepository.markLarge(accountId, OffsetDateTime.now(clock)) > 0) {
            log.info("promoted account {} to large account with {} subscriptions", accountId, subscriptionCount);
        }

        cache.evictIfPresent(String.format("isLarge:%d", accountId));
    }
}
