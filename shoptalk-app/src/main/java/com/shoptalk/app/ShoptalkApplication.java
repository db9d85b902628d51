package com.shoptalk.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.shoptalk")
@EnableScheduling
public class ShoptalkApplication {
    public static void main(String[] args) {
        SpringApplication.run(ShoptalkApplication.class, args);
    }
}
