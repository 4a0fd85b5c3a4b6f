package com.stockdiscussion.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StockDiscussionCollectorApplication {

  public static void main(String[] args) {
    SpringApplication.run(StockDiscussionCollectorApplication.class, args);
  }
}
