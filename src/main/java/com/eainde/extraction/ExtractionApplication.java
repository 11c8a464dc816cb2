package com.eainde.extraction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExtractionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExtractionApplication.class, args);
    }
}
