package com.eainde.policyaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PolicyAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(PolicyAuditApplication.class, args);
    }
}
