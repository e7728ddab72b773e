package com.atelier.sync.listener.logging.autoconfigure;

import com.atelier.sync.core.status.SyncStatusListener;
import com.atelier.sync.listener.logging.LoggingStatusListener;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
public class LoggingStatusListenerAutoConfiguration {

    @Bean
    @ConditionalOnProperty(
            prefix = "atelier.sync.logging",
            name = "enabled",
            havingValue = "true",
            matchIfMissing = true)
    @ConditionalOnMissingBean(name = "loggingStatusListener")
    public SyncStatusListener loggingStatusListener() {
        return new LoggingStatusListener();
    }
}
