package com.flamingo.ai.chunx;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the chunking service. */
@SpringBootApplication
public class ChunxApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChunxApplication.class, args);
  }
}
