package com.jreinhal.tieredrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TieredRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(TieredRagApplication.class, args);
    }
}
