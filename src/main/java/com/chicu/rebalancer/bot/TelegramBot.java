package com.chicu.rebalancer.bot;

import com.chicu.rebalancer.rebalance.model.RebalanceOperation;
import com.chicu.rebalancer.rebalance.store.OperationStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

import java.time.Instant;
import java.util.List;

import static com.chicu.rebalancer.bot.util.TelegramText.escapeHtml;
import static com.chicu.rebalancer.bot.util.TelegramText.isParseError;
import static com.chicu.rebalancer.bot.util.TelegramText.isTooLongError;
import static com.chicu.rebalancer.bot.util.TelegramText.paginate;
import static com.chicu.rebalancer.bot.util.TelegramText.stripHtml;

@Slf4j
@Component
@RequiredArgsConstructor
@SuppressWarnings("deprecation")
public class TelegramBot extends TelegramLongPollingBot {

    // практический лимит телеги 4096, оставим запас под разметку
    private static final int SAFE_SEND = 3300;

    private final TelegramBotProperties props;
    private final OperationStore operationStore;

    private volatile boolean registered;

    @PostConstruct
    public void init() {
        if (props.getToken() == null || props.getToken().isBlank()) {
            log.warn("telegram.bot.token не задан — бот не регистрируется, уведомления только в лог");
            return;
        }
        try {
            new TelegramBotsApi(DefaultBotSession.class).registerBot(this);
            registered = true;
            log.info("TelegramBot @{} зарегистрирован", props.getUsername());
        } catch (TelegramApiException e) {
            log.error("Не удалось зарегистрировать бота", e);
        }
    }

    @Override public String getBotUsername() { return props.getUsername(); }
    @Override @Deprecated public String getBotToken() { return props.getToken(); }

    public boolean isRegistered() {
        return registered;
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (!update.hasMessage() || !update.getMessage().hasText()) return;
        Message in = update.getMessage();
        String command = in.getText().trim().split("\\s+")[0];

        if (command.equals("/status") || command.startsWith("/status@")) {
            log.info("Команда /status из чата {}", in.getChatId());
            sendHtml(in.getChatId().toString(), renderStatus());
        }
    }

    String renderStatus() {
        StringBuilder sb = new StringBuilder()
                .append("🤖 Bot is running\n")
                .append("Timestamp: ").append(Instant.now()).append('\n');
        try {
            operationStore.findLatest().ifPresentOrElse(
                    op -> appendOperation(sb, op),
                    () -> sb.append("No rebalance operations yet"));
        } catch (Exception e) {
            log.warn("/status: не удалось прочитать последнюю операцию: {}", e.getMessage());
            sb.append("Last operation: unavailable");
        }
        return sb.toString();
    }

    private static void appendOperation(StringBuilder sb, RebalanceOperation op) {
        sb.append("Last operation: <code>").append(escapeHtml(op.getId())).append("</code>\n")
                .append("Direction: ").append(op.getDirection()).append('\n')
                .append("Status: <b>").append(op.getStatus()).append("</b>");
        if (op.getBridgeTxHash() != null) {
            sb.append("\nTx: <code>").append(escapeHtml(op.getBridgeTxHash())).append("</code>");
        }
        if (op.getErrorMessage() != null) {
            sb.append("\nError: ").append(escapeHtml(op.getErrorMessage()));
        }
    }

    /* ===================== send with fallbacks ===================== */

    /**
     * Отправка HTML-сообщения. Длинное режется на части,
     * при ошибке разбора сущностей уходит plain text. Ошибки доставки только логируются.
     */
    public void sendHtml(String chatId, String html) {
        if (html.length() > SAFE_SEND) {
            sendPaginated(chatId, html);
            return;
        }
        try {
            executeHtml(chatId, html);
        } catch (TelegramApiRequestException e) {
            if (isTooLongError(e)) {
                log.warn("sendMessage: MESSAGE_TOO_LONG — выполняю разбиение");
                sendPaginated(chatId, html);
                return;
            }
            if (isParseError(e)) {
                log.warn("sendMessage: не разобрался HTML — отправляю plain text");
                safeExecute(SendMessage.builder().chatId(chatId).text(stripHtml(html)).build());
                return;
            }
            log.error("Ошибка при отправке сообщения", e);
        } catch (TelegramApiException e) {
            log.error("Ошибка при отправке сообщения", e);
        }
    }

    private void sendPaginated(String chatId, String html) {
        // куски без разметки: разрез посреди тега ломает HTML
        List<String> parts = paginate(stripHtml(html), SAFE_SEND);
        for (String part : parts) {
            safeExecute(SendMessage.builder().chatId(chatId).text(part).build());
        }
    }

    private void executeHtml(String chatId, String html) throws TelegramApiException {
        execute(SendMessage.builder()
                .chatId(chatId)
                .text(html)
                .parseMode("HTML")
                .disableWebPagePreview(true)
                .build());
    }

    private void safeExecute(SendMessage msg) {
        try {
            execute(msg);
        } catch (TelegramApiException e) {
            log.error("Ошибка при отправке сообщения (fallback)", e);
        }
    }
}
