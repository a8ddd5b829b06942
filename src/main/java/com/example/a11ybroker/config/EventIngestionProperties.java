package com.example.a11ybroker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "broker.events")
@Data
public class EventIngestionProperties {

    private int maxBatchSize = 100;
}
