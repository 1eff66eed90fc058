package com.sitepulse.seo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SitePulseApplication {

  public static void main(String[] args) {
    SpringApplication.run(SitePulseApplication.class, args);
  }
}
