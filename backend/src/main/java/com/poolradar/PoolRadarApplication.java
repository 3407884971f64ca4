package com.poolradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PoolRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(PoolRadarApplication.class, args);
    }
}
