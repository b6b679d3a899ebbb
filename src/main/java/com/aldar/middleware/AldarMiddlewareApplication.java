package com.aldar.middleware;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AldarMiddlewareApplication {

    public static void main(String[] args) {
        SpringApplication.run(AldarMiddlewareApplication.class, args);
    }
}
