package com.iudex.cograg;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IudexCogRagApplication {
    public static void main(String[] args) {
        SpringApplication.run(IudexCogRagApplication.class, args);
    }
}
