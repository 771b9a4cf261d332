package com.chanakya.littleyears.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "littleyears")
public record LittleYearsProperties(
        @DefaultValue Seed seed
) {
    public record Seed(
            @DefaultValue("true") boolean enabled
    ) {}
}
