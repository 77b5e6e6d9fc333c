package com.routelens;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@Slf4j
public class RouteLensApplication {

    public static void main(String[] args) {
        log.info("Starting RouteLens debug core");
        SpringApplication.run(RouteLensApplication.class, args);
        log.info("RouteLens debug core started");
    }

}
