package com.fillbot.hft.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FillerServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(FillerServiceApplication.class, args);
  }
}
