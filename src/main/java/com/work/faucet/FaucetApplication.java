package com.work.faucet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口：POST /request 领取一次原生资产。
 */
@SpringBootApplication
@EnableScheduling
public class FaucetApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaucetApplication.class, args);
    }
}
