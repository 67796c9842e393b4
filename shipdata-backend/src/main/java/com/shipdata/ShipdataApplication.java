package com.shipdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShipdataApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShipdataApplication.class, args);
    }
}
