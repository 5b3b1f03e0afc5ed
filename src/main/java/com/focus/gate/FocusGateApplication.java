package com.focus.gate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FocusGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(FocusGateApplication.class, args);
    }
}
