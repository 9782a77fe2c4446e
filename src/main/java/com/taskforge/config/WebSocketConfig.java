package com.taskforge.config;

import com.taskforge.stream.TaskStreamWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final TaskStreamWebSocketHandler taskStreamWebSocketHandler;

    public WebSocketConfig(TaskStreamWebSocketHandler taskStreamWebSocketHandler) {
        this.taskStreamWebSocketHandler = taskStreamWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(taskStreamWebSocketHandler, "/ws/tasks")
                .setAllowedOrigins("*");
    }
}
