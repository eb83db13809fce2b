package com.aijudge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AiJudgeApplication {
    public static void main(String[] args) {
        SpringApplication.run(AiJudgeApplication.class, args);
    }
}
