package com.flamingo.ai.dossier;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the conversation dossier backend. */
@SpringBootApplication
public class DossierApplication {

  public static void main(String[] args) {
    SpringApplication.run(DossierApplication.class, args);
  }
}
