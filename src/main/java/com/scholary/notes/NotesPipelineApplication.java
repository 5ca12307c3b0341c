package com.scholary.notes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NotesPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(NotesPipelineApplication.class, args);
  }
}
