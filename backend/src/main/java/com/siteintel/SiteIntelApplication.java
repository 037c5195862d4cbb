package com.siteintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SiteIntelApplication {

  public static void main(String[] args) {
    SpringApplication.run(SiteIntelApplication.class, args);
  }
}
