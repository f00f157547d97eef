package com.mintstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MintstreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(MintstreamApplication.class, args);
    }
}
