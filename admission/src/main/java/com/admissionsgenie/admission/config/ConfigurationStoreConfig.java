package com.admissionsgenie.admission.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Creates a ConfigurationStore instance.
 *
 * If the configstore.mode is set to "seed", the store starts with the demo facilities, rate
 * records and cost models from {@link ConfigurationSeeder}.
 *
 * If the configstore.mode is set to "empty", the store starts with no records.
 */
@Configuration
public class ConfigurationStoreConfig {
    @Bean
    @Primary
    @ConditionalOnProperty(name = "configstore.mode", havingValue = "seed", matchIfMissing = true)
    public ConfigurationStore seededConfigurationStore() {
        ConfigurationStore store = new ConfigurationStore();
        ConfigurationSeeder.seed(store);
        return store;
    }

    @Bean
    @Primary
    @ConditionalOnProperty(name = "configstore.mode", havingValue = "empty")
    public ConfigurationStore emptyConfigurationStore() {
        return new ConfigurationStore();
    }
}
