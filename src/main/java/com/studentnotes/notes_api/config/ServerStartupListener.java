package com.studentnotes.notes_api.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ServerStartupListener {

    @Value("${notes.environment:development}")
    private String environment;

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        log.info("Student Notes API 서버 실행 중 - 포트: {}", event.getWebServer().getPort());
        log.info("실행 환경: {}", environment);
    }
}
