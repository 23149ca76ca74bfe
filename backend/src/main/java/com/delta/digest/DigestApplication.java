package com.delta.digest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DigestApplication {

  public static void main(String[] args) {
    SpringApplication.run(DigestApplication.class, args);
  }
}
