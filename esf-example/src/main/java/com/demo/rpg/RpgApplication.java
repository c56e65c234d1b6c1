package com.demo.rpg;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RpgApplication {
    public static void main(String[] args) {
        SpringApplication.run(RpgApplication.class, args);
    }
}
