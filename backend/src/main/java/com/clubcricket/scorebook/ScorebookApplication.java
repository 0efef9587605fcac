package com.clubcricket.scorebook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScorebookApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScorebookApplication.class, args);
    }
}
