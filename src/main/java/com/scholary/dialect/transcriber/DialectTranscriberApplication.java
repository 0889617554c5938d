package com.scholary.dialect.transcriber;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DialectTranscriberApplication {

  public static void main(String[] args) {
    SpringApplication.run(DialectTranscriberApplication.class, args);
  }
}
