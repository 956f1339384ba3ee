package io.b2mash.b2b.deliverytracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DeliveryTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeliveryTrackerApplication.class, args);
  }
}
