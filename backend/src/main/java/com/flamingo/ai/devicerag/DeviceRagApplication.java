package com.flamingo.ai.devicerag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the device document RAG service. */
@SpringBootApplication
public class DeviceRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeviceRagApplication.class, args);
  }
}
