package com.example.truingup;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TruingUpApplication {

    public static void main(String[] args) {
        SpringApplication.run(TruingUpApplication.class, args);
    }
}
