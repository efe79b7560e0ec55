package com.jsoonworld.delivery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NotificationDeliveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotificationDeliveryApplication.class, args);
    }
}
