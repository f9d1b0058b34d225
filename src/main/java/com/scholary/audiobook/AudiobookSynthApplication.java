package com.scholary.audiobook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class AudiobookSynthApplication {

  public static void main(String[] args) {
    SpringApplication.run(AudiobookSynthApplication.class, args);
  }
}
