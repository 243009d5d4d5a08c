package com.jay.underwriter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class UnderwriterApplication {
    public static void main(String[] args) {
        SpringApplication.run(UnderwriterApplication.class, args);
    }
}
