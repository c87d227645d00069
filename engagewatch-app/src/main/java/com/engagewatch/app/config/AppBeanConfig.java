package com.engagewatch.app.config;

import com.engagewatch.common.config.ConfigService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for shared application beans.
 */
@Configuration
public class AppBeanConfig {

    @Value("${engagewatch.config.path:~/.engagewatch/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        String resolvedPath = configPath;
        if (resolvedPath.startsWith("~")) {
            resolvedPath = System.getProperty("user.home") + resolvedPath.substring(1);
        }
        return new ConfigService(Path.of(resolvedPath));
    }
}
