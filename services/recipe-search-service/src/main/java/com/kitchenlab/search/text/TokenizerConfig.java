package com.kitchenlab.search.text;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TokenizerProperties.class)
public class TokenizerConfig {
}
