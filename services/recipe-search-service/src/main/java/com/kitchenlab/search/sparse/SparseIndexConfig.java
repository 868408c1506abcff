package com.kitchenlab.search.sparse;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SparseIndexProperties.class)
public class SparseIndexConfig {
}
