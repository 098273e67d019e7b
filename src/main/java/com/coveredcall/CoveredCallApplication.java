package com.coveredcall;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoveredCallApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoveredCallApplication.class, args);
    }
}
