package com.example.scan2doc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class Scan2DocServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(Scan2DocServerApplication.class, args);
    }

}
