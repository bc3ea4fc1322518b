package com.apistack.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * API Stack Application
 * Hosts the request pipeline in front of the application's own controllers
 */
@SpringBootApplication
@EnableConfigurationProperties
public class ApiStackApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiStackApplication.class, args);
    }
}
