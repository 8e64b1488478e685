package com.uiplan.infrastructure.planner.config;

import com.uiplan.infrastructure.planner.template.PlaceholderContent;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ComponentWhitelist.class)
public class PlannerConfig {

    @Bean
    public PlaceholderContent placeholderContent() {
        return PlaceholderContent.defaults();
    }
}
