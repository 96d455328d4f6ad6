package com.delta.marketloader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MarketLoaderApplication {

  public static void main(String[] args) {
    SpringApplication.run(MarketLoaderApplication.class, args);
  }
}
