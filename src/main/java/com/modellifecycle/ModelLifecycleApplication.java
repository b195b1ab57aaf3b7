package com.modellifecycle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ModelLifecycleApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModelLifecycleApplication.class, args);
    }
}
