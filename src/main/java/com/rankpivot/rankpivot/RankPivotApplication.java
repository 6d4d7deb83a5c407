package com.rankpivot.rankpivot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RankPivotApplication {

    public static void main(String[] args) {
        SpringApplication.run(RankPivotApplication.class, args);
    }
}
