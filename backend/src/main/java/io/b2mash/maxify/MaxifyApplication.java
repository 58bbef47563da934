package io.b2mash.maxify;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MaxifyApplication {

  public static void main(String[] args) {
    SpringApplication.run(MaxifyApplication.class, args);
  }
}
