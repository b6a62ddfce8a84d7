package com.hhplus.orderengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrderEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderEngineApplication.class, args);
    }
}
