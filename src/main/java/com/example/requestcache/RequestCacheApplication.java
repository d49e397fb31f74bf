package com.example.requestcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RequestCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(RequestCacheApplication.class, args);
    }
}
