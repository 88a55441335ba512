package com.example.hybridrec;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.hybridrec.mapper")
@ConfigurationPropertiesScan
@EnableScheduling
public class HybridRecApplication {

    public static void main(String[] args) {
        SpringApplication.run(HybridRecApplication.class, args);
    }
}
