package com.yerin.notijob;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class NotijobApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotijobApplication.class, args);
    }

}
