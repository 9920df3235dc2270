package com.jay.dcf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DcfEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(DcfEngineApplication.class, args);
    }
}
