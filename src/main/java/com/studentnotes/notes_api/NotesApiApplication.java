package com.studentnotes.notes_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;

// 인증을 쓰지 않으므로 기본 사용자 계정 자동 생성은 끈다
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
public class NotesApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotesApiApplication.class, args);
    }

}
