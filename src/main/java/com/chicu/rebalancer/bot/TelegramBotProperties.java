package com.chicu.rebalancer.bot;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Свойства бота: токен, username и чат оператора.
 * Читаются из application.yml.
 */
@Component
@ConfigurationProperties(prefix = "telegram.bot")
@Data
public class TelegramBotProperties {
    /**
     * username бота без "@"
     */
    private String username;
    /**
     * Токен, полученный от BotFather
     */
    private String token;
    /**
     * Чат, куда уходят уведомления о ребалансировке
     */
    private String adminChatId;
}
