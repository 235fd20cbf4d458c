package com.overlaychat.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OverlayServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(OverlayServerApplication.class, args);
    }
}
