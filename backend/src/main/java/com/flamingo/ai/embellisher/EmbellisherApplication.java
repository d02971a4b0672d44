package com.flamingo.ai.embellisher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the note embellisher backend. */
@SpringBootApplication
public class EmbellisherApplication {

  public static void main(String[] args) {
    SpringApplication.run(EmbellisherApplication.class, args);
  }
}
