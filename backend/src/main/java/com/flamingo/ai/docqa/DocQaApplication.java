package com.flamingo.ai.docqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the document Q&A backend. */
@SpringBootApplication
public class DocQaApplication {

  public static void main(String[] args) {
    SpringApplication.run(DocQaApplication.class, args);
  }
}
