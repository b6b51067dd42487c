package com.bank.categorization.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "categorization.tenants")
public class TenantConfig {

    // Tenant ids registered on startup when absent.
    private List<String> bootstrap = new ArrayList<>();
}
