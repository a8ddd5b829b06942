package com.example.a11ybroker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class A11yBrokerApplication {

    public static void main(String[] args) {
        SpringApplication.run(A11yBrokerApplication.class, args);
    }
}
