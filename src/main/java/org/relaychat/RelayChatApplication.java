package org.relaychat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling  // relais de l'outbox et purge
public class RelayChatApplication {
    public static void main(String[] args) {
        SpringApplication.run(RelayChatApplication.class, args);
    }
}
