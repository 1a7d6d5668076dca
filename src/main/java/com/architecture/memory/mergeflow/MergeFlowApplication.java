package com.architecture.memory.mergeflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MergeFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(MergeFlowApplication.class, args);
    }
}
