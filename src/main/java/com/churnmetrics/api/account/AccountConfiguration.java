package com.churnmetrics.api.account;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties used by various components in the account package.
 */
@Validated
@ConfigurationProperties("app.accounts")
@Data
class AccountConfiguration {

    /**
     * TTL for account attributes (timezone, large-account flag) in the account cache.
     */
    @NotNull
    private final Duration cacheTtl;

    /**
     * Number of subscriptions at which an account is promoted to a large account.
     */
    @Min(1)
    private final long largeAccountSubscriptionThreshold;
}
