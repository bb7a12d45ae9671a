package com.eainde.safepulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SafePulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(SafePulseApplication.class, args);
    }
}
