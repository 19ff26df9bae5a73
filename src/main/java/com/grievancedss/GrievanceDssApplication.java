package com.grievancedss;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GrievanceDssApplication {

    public static void main(String[] args) {
        SpringApplication.run(GrievanceDssApplication.class, args);
    }
}
