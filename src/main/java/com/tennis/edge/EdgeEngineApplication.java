package com.tennis.edge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EdgeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdgeEngineApplication.class, args);
    }
}
