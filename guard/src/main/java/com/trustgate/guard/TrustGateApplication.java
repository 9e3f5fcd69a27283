package com.trustgate.guard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrustGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrustGateApplication.class, args);
    }
}
