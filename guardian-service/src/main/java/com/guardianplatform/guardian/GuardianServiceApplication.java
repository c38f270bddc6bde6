package com.guardianplatform.guardian;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GuardianServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardianServiceApplication.class, args);
    }
}
