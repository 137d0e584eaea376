package me.go_gradually.ivrphone.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "me.go_gradually.ivrphone")
public class IvrPhoneApplication {
    public static void main(String[] args) {
        SpringApplication.run(IvrPhoneApplication.class, args);
    }
}
