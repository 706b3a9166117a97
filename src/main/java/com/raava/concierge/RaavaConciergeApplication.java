package com.raava.concierge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RaavaConciergeApplication {

    public static void main(String[] args) {
        SpringApplication.run(RaavaConciergeApplication.class, args);
    }
}
