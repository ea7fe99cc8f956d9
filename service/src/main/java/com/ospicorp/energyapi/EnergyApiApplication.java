package com.ospicorp.energyapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EnergyApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(EnergyApiApplication.class, args);
  }
}
