package com.qurse.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class QurseBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(QurseBackendApplication.class, args);
  }
}
