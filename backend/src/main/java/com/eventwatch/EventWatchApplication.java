package com.eventwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventWatchApplication.class, args);
    }
}
