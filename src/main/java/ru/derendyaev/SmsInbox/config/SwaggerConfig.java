package ru.derendyaev.SmsInbox.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    @Bean
    public OpenAPI smsInboxOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SMS Inbox API")
                        .description("""
                                Приём подписанных вебхуков с входящими сообщениями.
                                Идемпотентное сохранение по message_id, постраничный список с фильтрами и статистика.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Derendyaev Project")
                                .email("support@sms-gateway.derendyaev.ru")
                                .url("https://sms-gateway.derendyaev.ru"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }
}
