package com.purchasingpower.proofengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProofEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProofEngineApplication.class, args);
    }
}
