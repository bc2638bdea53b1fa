package com.solprofile;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SolProfileApplication {

    public static void main(String[] args) {
        SpringApplication.run(SolProfileApplication.class, args);
    }
}
