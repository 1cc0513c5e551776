package com.jfind;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JFindServiceApplication {

  public static void main(String[] args) {
    SpringApplication.run(JFindServiceApplication.class, args);
  }
}
