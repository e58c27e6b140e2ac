package com.example.embeddingindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(EmbeddingIndexProperties.class)
public class EmbeddingIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmbeddingIndexApplication.class, args);
    }
}
