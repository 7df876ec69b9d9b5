package com.panda.stackdeployer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StackDeployerApplication {

    public static void main(String[] args) {
        SpringApplication.run(StackDeployerApplication.class, args);
    }
}
