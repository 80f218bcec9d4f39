package com.lendmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LendmatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(LendmatchApplication.class, args);
    }
}
