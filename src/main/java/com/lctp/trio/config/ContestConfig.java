package com.lctp.trio.config;

import com.lctp.trio.engine.CategoryRuleSet;
import com.lctp.trio.engine.ConfiguredPointTable;
import com.lctp.trio.engine.PointTable;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

@Configuration
@EnableJpaAuditing
@EnableConfigurationProperties({ContepProperties.class, QuotaProperties.class})
public class ContestConfig {

    @Bean
    public CategoryRuleSet categoryRuleSet() {
        return CategoryRuleSet.standard();
    }

    @Bean
    public PointTable pointTable(ContepProperties contepProperties) {
        return new ConfiguredPointTable(contepProperties);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public Random drawRandom() {
        return new SecureRandom();
    }
}
