package com.flamingo.ai.ragdocs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the documentation retrieval service. */
@SpringBootApplication
public class RagDocsApplication {

  public static void main(String[] args) {
    SpringApplication.run(RagDocsApplication.class, args);
  }
}
