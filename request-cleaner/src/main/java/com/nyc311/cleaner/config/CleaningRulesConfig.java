package com.nyc311.cleaner.config;

import com.nyc311.cleaner.model.CleaningRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

@Configuration
@Slf4j
public class CleaningRulesConfig {

    @Bean
    public CleaningRules cleaningRules(CleanerProperties properties) {
        CleanerProperties.Rules rules = properties.getRules();
        if (rules.getMinCreatedYear() > rules.getMaxCreatedYear()) {
            throw new IllegalArgumentException("cleaner.rules.min-created-year must not exceed max-created-year");
        }

        CleaningRules built = CleaningRules.builder()
                .minCreatedYear(rules.getMinCreatedYear())
                .maxCreatedYear(rules.getMaxCreatedYear())
                .minLatitude(rules.getMinLatitude())
                .maxLatitude(rules.getMaxLatitude())
                .minLongitude(rules.getMinLongitude())
                .maxLongitude(rules.getMaxLongitude())
                .rejectUnknownBoroughs(rules.isRejectUnknownBoroughs())
                .categoryAllowList(Set.copyOf(rules.getCategories()))
                .build();

        log.info("Cleaning rules: years {}-{}, {} complaint categories, unknown boroughs {}",
                built.getMinCreatedYear(), built.getMaxCreatedYear(),
                built.getCategoryAllowList().size(),
                built.isRejectUnknownBoroughs() ? "dropped" : "passed through");
        return built;
    }
}
