package com.matcast.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MatcastApplication {

    public static void main(String[] args) {
        SpringApplication.run(MatcastApplication.class, args);
    }
}
