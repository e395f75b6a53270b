package com.feedblend.blend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlendServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlendServiceApplication.class, args);
    }
}
