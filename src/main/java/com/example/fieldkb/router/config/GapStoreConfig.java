package com.example.fieldkb.router.config;

import com.example.fieldkb.router.dao.GapStore;
import com.example.fieldkb.router.dao.InMemoryGapStore;
import com.example.fieldkb.router.dao.InMemoryResearchQueue;
import com.example.fieldkb.router.dao.JdbcGapStore;
import com.example.fieldkb.router.dao.JdbcOutboxResearchQueue;
import com.example.fieldkb.router.dao.ResearchQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/** Selects the gap store and research queue with {@code router.gap.store}. */
@Slf4j
@Configuration
public class GapStoreConfig {

    @Configuration
    @ConditionalOnProperty(name = "router.gap.store", havingValue = "jdbc", matchIfMissing = true)
    static class Jdbc {

        @Bean
        public GapStore gapStore(JdbcTemplate jdbcTemplate) {
            return new JdbcGapStore(jdbcTemplate);
        }

        @Bean
        public ResearchQueue researchQueue(JdbcTemplate jdbcTemplate, RouterProperties properties) {
            return new JdbcOutboxResearchQueue(jdbcTemplate, properties.getGap().getOutbox().getTable());
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "router.gap.store", havingValue = "memory")
    static class Memory {

        @Bean
        public GapStore gapStore() {
            log.warn("Using in-memory gap store; gaps are lost on restart");
            return new InMemoryGapStore();
        }

        @Bean
        public ResearchQueue researchQueue() {
            return new InMemoryResearchQueue();
        }
    }
}
