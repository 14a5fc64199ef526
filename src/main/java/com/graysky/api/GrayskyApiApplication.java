package com.graysky.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GrayskyApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(GrayskyApiApplication.class, args);
    }
}
