package com.docfederation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DocFederationApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocFederationApplication.class, args);
    }
}
