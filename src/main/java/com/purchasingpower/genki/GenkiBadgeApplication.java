package com.purchasingpower.genki;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class GenkiBadgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(GenkiBadgeApplication.class, args);
    }
}
