package com.cafepos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
public class CafePosApplication {

    public static void main(String[] args) {
        SpringApplication.run(CafePosApplication.class, args);
    }
}
