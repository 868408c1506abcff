package com.kitchenlab.search.filter;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FilterProperties.class)
public class FilterConfig {

    @Bean
    public FilterPolicy filterPolicy(FilterProperties properties) {
        return FilterPolicy.from(properties);
    }
}
