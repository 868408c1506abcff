package com.kitchenlab.search.fusion;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(FusionProperties.class)
public class FusionConfig {
}
