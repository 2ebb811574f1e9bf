package com.example.techsewa;

import com.example.techsewa.config.TechsewaProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(TechsewaProperties.class)
public class TechsewaApplication {

    public static void main(String[] args) {
        SpringApplication.run(TechsewaApplication.class, args);
    }
}
