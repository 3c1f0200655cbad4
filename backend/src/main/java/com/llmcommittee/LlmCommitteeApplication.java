package com.llmcommittee;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LlmCommitteeApplication {

    public static void main(String[] args) {
        SpringApplication.run(LlmCommitteeApplication.class, args);
    }
}
