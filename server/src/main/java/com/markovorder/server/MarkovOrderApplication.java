package com.markovorder.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarkovOrderApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarkovOrderApplication.class, args);
    }
}
