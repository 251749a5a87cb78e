package com.flamingo.ai.deepresearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the deep research back end. */
@SpringBootApplication
public class DeepResearchApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeepResearchApplication.class, args);
  }
}
