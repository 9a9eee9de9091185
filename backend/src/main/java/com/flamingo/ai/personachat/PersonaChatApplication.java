package com.flamingo.ai.personachat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Creator persona chat backend: catalog ingestion pipeline and transcript-grounded chat. */
@SpringBootApplication
@EnableScheduling
public class PersonaChatApplication {

  public static void main(String[] args) {
    SpringApplication.run(PersonaChatApplication.class, args);
  }
}
