package com.poc.eurverifier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EurVerifierApplication {

    public static void main(String[] args) {
        SpringApplication.run(EurVerifierApplication.class, args);
    }
}
