package com.example.a11ybroker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for compliance reporting, bound from application.yml
 * (broker.compliance.*).
 */
@Component
@ConfigurationProperties(prefix = "broker.compliance")
@Data
public class ComplianceProperties {

    // certificate URL is "{base}/{app_id}-{level}"
    private String certificateBaseUrl = "https://pinksync.org/certificates";
}
