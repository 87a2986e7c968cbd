package com.changeguard.core.change;

import com.changeguard.core.config.WorkspaceProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ChangeStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "changeguard.change.store", havingValue = "file", matchIfMissing = true)
    public ChangeRepository jsonFileChangeRepository(ChangeProperties properties, WorkspaceProperties workspace,
                                                     ObjectMapper objectMapper) {
        return new JsonFileChangeRepository(workspace.resolve(properties.getStorePath()), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "changeguard.change.store", havingValue = "memory")
    public ChangeRepository inMemoryChangeRepository() {
        return new InMemoryChangeRepository();
    }
}
