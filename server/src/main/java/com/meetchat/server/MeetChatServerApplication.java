package com.meetchat.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeetChatServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetChatServerApplication.class, args);
    }
}
