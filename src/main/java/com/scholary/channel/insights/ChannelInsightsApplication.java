package com.scholary.channel.insights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChannelInsightsApplication {

  public static void main(String[] args) {
    SpringApplication.run(ChannelInsightsApplication.class, args);
  }
}
