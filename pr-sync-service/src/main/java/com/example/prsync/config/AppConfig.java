package com.example.prsync.config;

import com.example.prsync.service.transition.TransitionPathLoader;
import com.example.prsync.service.transition.TransitionPathTable;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PrSyncProperties.class)
public class AppConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Operator path table from {@code prsync.jira.transition-paths-file}, merged with the built-in paths.
     */
    @Bean
    TransitionPathTable transitionPathTable(TransitionPathLoader loader, PrSyncProperties properties) {
        return loader.load(properties.jira().transitionPathsFile());
    }
}
