package com.churnmetrics.api.churn;

import com.churnmetrics.api.churn.source.ChurnDataSource;
import com.churnmetrics.api.churn.source.IndexAggregationSource;
import com.churnmetrics.api.churn.source.RelationalScanSource;
import com.churnmetrics.api.subscription.entities.SubscriptionIndexRepository;
import com.churnmetrics.api.subscription.entities.SubscriptionRepository;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring Beans used by the churn package.
 */
@Configuration
@Slf4j
class ChurnBeans {

    @NonNull
    @Bean
    ChurnDataSource churnDataSource(
        @NonNull ChurnConfiguration config,
        @NonNull SubscriptionRepository subscriptionRepository,
        @NonNull SubscriptionIndexRepository subscriptionIndexRepository
    ) {
        log.info("using {} churn data source", config.getDataSource());
        if (config.getDataSource() == ChurnConfiguration.DataSourceType.SCAN) {
            return new RelationalScanSource(subscriptionRepository);
        }

        return new IndexAggregationSource(subscriptionIndexRepository);
    }

    @NonNull
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
