package com.venturegate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VentureGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(VentureGateApplication.class, args);
    }
}
