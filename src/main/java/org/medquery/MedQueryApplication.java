package org.medquery;

import org.medquery.configuration.MedQueryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MedQueryProperties.class)
public class MedQueryApplication {
    public static void main(String[] args) {
        SpringApplication.run(MedQueryApplication.class, args);
    }
}
