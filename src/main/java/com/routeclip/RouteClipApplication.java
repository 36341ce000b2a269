package com.routeclip;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RouteClipApplication {

    public static void main(String[] args) {
        SpringApplication.run(RouteClipApplication.class, args);
    }
}
