package com.atelier.sync.spring.autoconfigure;

import com.atelier.project.validation.PayloadValidator;
import com.atelier.sync.core.engine.SyncEngine;
import com.atelier.sync.core.status.SyncStatusListener;
import com.atelier.sync.core.store.JsonFileLocalStore;
import com.atelier.sync.core.validation.InlineBinaryDetector;
import com.atelier.sync.spi.LocalStore;
import com.atelier.sync.spi.RemoteStore;
import com.atelier.sync.spi.blob.BlobStore;
import com.atelier.sync.spi.identity.IdentityProvider;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires a {@link SyncEngine} from the application's {@link RemoteStore} and {@link BlobStore} beans. The local store
 * and validator default to the JSON-file store and the inline binary detector. Every {@link SyncStatusListener}
 * bean is registered with the engine, and an {@link IdentityProvider} bean, if present, drives its session.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(AtelierSyncProperties.class)
@ConditionalOnProperty(prefix = "atelier.sync", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SyncAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public LocalStore atelierLocalStore(AtelierSyncProperties properties) {
        Path directory = Path.of(properties.getLocalStore().getDirectory());
        log.info("Using JSON file local store at {}", directory.toAbsolutePath());
        return new JsonFileLocalStore(directory);
    }

    @Bean
    @ConditionalOnMissingBean
    public PayloadValidator atelierPayloadValidator() {
        return new InlineBinaryDetector();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean({RemoteStore.class, BlobStore.class})
    public SyncEngine syncEngine(
            AtelierSyncProperties properties,
            LocalStore localStore,
            RemoteStore remoteStore,
            BlobStore blobStore,
            PayloadValidator validator,
            ObjectProvider<SyncStatusListener> statusListeners,
            ObjectProvider<IdentityProvider> identityProvider) {
        SyncEngine.Builder builder = SyncEngine.builder()
                .localStore(localStore)
                .remoteStore(remoteStore)
                .blobStore(blobStore)
                .validator(validator)
                .settings(properties.toSettings());
        statusListeners.orderedStream().forEach(builder::statusListener);
        SyncEngine engine = builder.build();
        identityProvider.ifAvailable(engine::bind);
        return engine;
    }
}
