package com.flamingo.ai.labmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the lab matching service. */
@SpringBootApplication
public class LabMatchApplication {

  public static void main(String[] args) {
    SpringApplication.run(LabMatchApplication.class, args);
  }
}
