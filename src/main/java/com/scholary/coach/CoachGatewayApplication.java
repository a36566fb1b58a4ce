package com.scholary.coach;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoachGatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(CoachGatewayApplication.class, args);
  }
}
