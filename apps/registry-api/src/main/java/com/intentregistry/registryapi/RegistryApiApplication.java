package com.intentregistry.registryapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegistryApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(RegistryApiApplication.class, args);
  }
}
