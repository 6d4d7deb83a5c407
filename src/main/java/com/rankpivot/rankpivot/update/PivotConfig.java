package com.rankpivot.rankpivot.update;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables binding of pivot-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties(PivotProperties.class)
public class PivotConfig {
}
