package com.deepansh.desk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApprovalDeskApplication {
    public static void main(String[] args) {
        SpringApplication.run(ApprovalDeskApplication.class, args);
    }
}
