package com.sessionmemory.ai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SessionMemoryApplication {

  public static void main(String[] args) {
    SpringApplication.run(SessionMemoryApplication.class, args);
  }
}
