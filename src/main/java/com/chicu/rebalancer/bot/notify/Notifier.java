package com.chicu.rebalancer.bot.notify;

/**
 * Доставка человекочитаемых сообщений оператору.
 * Best effort: сбой доставки никогда не должен ронять ребалансировку.
 */
public interface Notifier {

    void sendInfo(String message);

    void sendError(String message);

    /** В канал уходит только текст ошибки, без стектрейса. */
    default void sendError(Throwable error) {
        sendError(describe(error));
    }

    static String describe(Throwable error) {
        if (error == null) return "unknown error";
        String msg = error.getMessage();
        return (msg == null || msg.isBlank()) ? error.getClass().getSimpleName() : msg;
    }
}
