package com.chicu.rebalancer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RebalancerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RebalancerApplication.class, args);
    }
}
