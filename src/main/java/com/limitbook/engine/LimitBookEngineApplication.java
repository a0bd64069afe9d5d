package com.limitbook.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LimitBookEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LimitBookEngineApplication.class, args);
    }

}
