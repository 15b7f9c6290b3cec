package com.multipost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MultipostApplication {
    public static void main(String[] args) {
        SpringApplication.run(MultipostApplication.class, args);
    }
}
