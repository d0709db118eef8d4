package com.flamingo.ai.talkpdf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Entry point for the TalkPDF document pipeline backend. */
@SpringBootApplication
@EnableScheduling
public class TalkPdfApplication {

  public static void main(String[] args) {
    SpringApplication.run(TalkPdfApplication.class, args);
  }
}
