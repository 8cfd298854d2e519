package com.purchasingpower.etlinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EtlInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(EtlInsightApplication.class, args);
    }
}
