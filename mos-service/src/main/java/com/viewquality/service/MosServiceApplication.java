package com.viewquality.service;

import com.viewquality.service.config.MosDefaultsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MosDefaultsProperties.class)
public class MosServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MosServiceApplication.class, args);
    }
}
