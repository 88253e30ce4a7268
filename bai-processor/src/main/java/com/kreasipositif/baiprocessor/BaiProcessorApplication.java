package com.kreasipositif.baiprocessor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class BaiProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(BaiProcessorApplication.class, args);
    }
}
