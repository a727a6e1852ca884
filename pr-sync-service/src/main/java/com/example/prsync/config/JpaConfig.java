package com.example.prsync.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA auditing: fills created_at on insert.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
