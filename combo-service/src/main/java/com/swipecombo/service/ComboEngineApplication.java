package com.swipecombo.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComboEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComboEngineApplication.class, args);
    }
}
