package com.cnfkit.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AnalyzerProperties.class)
public class CnfKitApplication {

    public static void main(String[] args) {
        SpringApplication.run(CnfKitApplication.class, args);
    }
}
