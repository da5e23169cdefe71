package com.trendlens.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.trendlens")
public class TrendlensApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(TrendlensApiApplication.class, args);
  }
}
