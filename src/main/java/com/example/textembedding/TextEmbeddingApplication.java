package com.example.textembedding;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point for the text embedding HTTP API.
 */
@SpringBootApplication
public class TextEmbeddingApplication {

    public static void main(String[] args) {
        SpringApplication.run(TextEmbeddingApplication.class, args);
    }
}
