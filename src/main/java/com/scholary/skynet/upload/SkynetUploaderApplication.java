package com.scholary.skynet.upload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class SkynetUploaderApplication {

  public static void main(String[] args) {
    SpringApplication.run(SkynetUploaderApplication.class, args);
  }
}
