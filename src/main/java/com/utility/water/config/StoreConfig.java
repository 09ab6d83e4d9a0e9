package com.utility.water.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "water.store")
public class StoreConfig {

    // "csv" or "aerospike"
    private String type = "csv";

    private String csvPath = "water_usage_data.csv";
}
