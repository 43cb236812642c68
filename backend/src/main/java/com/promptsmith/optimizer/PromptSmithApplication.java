package com.promptsmith.optimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PromptSmithApplication {

  public static void main(String[] args) {
    SpringApplication.run(PromptSmithApplication.class, args);
  }
}
