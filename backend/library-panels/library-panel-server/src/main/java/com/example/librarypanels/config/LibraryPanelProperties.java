package com.example.librarypanels.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param defaultRequestTimeout deadline applied to a request that does not bring its own
 */
@ConfigurationProperties(prefix = "library-panels")
public record LibraryPanelProperties(@DefaultValue("30s") Duration defaultRequestTimeout) {
}
