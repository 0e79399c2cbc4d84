package com.agentguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentGuardApplication.class, args);
    }
}
