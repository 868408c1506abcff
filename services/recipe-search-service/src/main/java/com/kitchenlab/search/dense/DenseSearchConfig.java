package com.kitchenlab.search.dense;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DenseSearchProperties.class)
public class DenseSearchConfig {
}
