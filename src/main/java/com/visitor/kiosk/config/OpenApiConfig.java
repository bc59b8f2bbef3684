package com.visitor.kiosk.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI kioskOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Visitor Management Kiosk Backend")
                        .description("API for Visitor Kiosk (Check-in, Speech, OCR, Notifications, Admin) "
                                + "with conversational logic and PostgreSQL integration.")
                        .version("1.0.0"))
                .tags(List.of(
                        new Tag().name("visitor").description("Visitor check-in and management"),
                        new Tag().name("ocr").description("ID OCR upload"),
                        new Tag().name("speech").description("STT/TTS APIs"),
                        new Tag().name("notifications").description("Notification triggers to hosts"),
                        new Tag().name("admin").description("Admin management & dashboard"),
                        new Tag().name("validation").description("Real-time field validation")));
    }
}
