package com.ehrportal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EhrPortalApplication {

    public static void main(String[] args) {
        SpringApplication.run(EhrPortalApplication.class, args);
    }
}
