package com.chicu.rebalancer.bot.notify.impl;

import com.chicu.rebalancer.bot.TelegramBot;
import com.chicu.rebalancer.bot.TelegramBotProperties;
import com.chicu.rebalancer.bot.notify.Notifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import static com.chicu.rebalancer.bot.util.TelegramText.escapeHtml;

/**
 * Уведомления оператору в Telegram (parse_mode=HTML).
 * Если бот не зарегистрирован или чат не задан — пишем только в лог.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TelegramNotifier implements Notifier {

    private final TelegramBot bot;
    private final TelegramBotProperties props;

    @Override
    public void sendInfo(String message) {
        log.info("🔔 {}", message);
        deliver("🔔 " + escapeHtml(message));
    }

    @Override
    public void sendError(String message) {
        log.warn("❌ {}", message);
        deliver("❌ Error:\n" + escapeHtml(message));
    }

    private void deliver(String html) {
        String chatId = props.getAdminChatId();
        if (chatId == null || chatId.isBlank() || !bot.isRegistered()) {
            log.debug("Уведомление не отправлено: бот не готов или admin-chat-id пуст");
            return;
        }
        try {
            bot.sendHtml(chatId, html);
        } catch (Exception e) {
            // доставка best effort, ребалансировку не роняем
            log.error("Не удалось отправить уведомление: {}", e.getMessage());
        }
    }
}
