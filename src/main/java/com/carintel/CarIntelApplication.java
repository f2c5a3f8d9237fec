package com.carintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Car Intel 차량 정보 API 애플리케이션
 */
@SpringBootApplication
public class CarIntelApplication {

    public static void main(String[] args) {
        SpringApplication.run(CarIntelApplication.class, args);
    }
}
