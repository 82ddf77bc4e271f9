package com.example.librarypanels.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.repository.config.EnableJdbcRepositories;

@Configuration
@EnableJdbcRepositories(
    basePackages = "com.example.librarypanels.repository.jdbc"
)
public class DatabaseConfig {
}
