package com.chicu.rebalancer.bot.util;

import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.util.ArrayList;
import java.util.List;

public final class TelegramText {
    private TelegramText() {}

    /** true, если это именно ошибка парсинга сущностей Telegram (HTML/Markdown). */
    public static boolean isParseError(Throwable e) {
        return responseContains(e, "can't parse entities");
    }

    public static boolean isTooLongError(Throwable e) {
        return responseContains(e, "message is too long");
    }

    /** Экранируем спецсимволы для parse_mode=HTML. */
    public static String escapeHtml(String s) {
        if (s == null) return "";
        return s
                .replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    /** Жёстко убираем HTML-теги и возвращаем сущности, для фолбэка в plain text. */
    public static String stripHtml(String s) {
        if (s == null) return "";
        return s.replaceAll("<[^>]+>", "")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&amp;", "&");
    }

    /** Режем текст на части не длиннее {@code limit}, по возможности по переводу строки. */
    public static List<String> paginate(String text, int limit) {
        List<String> parts = new ArrayList<>();
        if (text == null || text.isEmpty()) return parts;
        int from = 0;
        while (from < text.length()) {
            int to = Math.min(text.length(), from + limit);
            if (to < text.length()) {
                int nl = text.lastIndexOf('\n', to);
                if (nl > from) to = nl + 1;
            }
            parts.add(text.substring(from, to));
            from = to;
        }
        return parts;
    }

    private static boolean responseContains(Throwable e, String marker) {
        if (e instanceof TelegramApiRequestException req) {
            String r = req.getApiResponse();
            String m = req.getMessage();
            return (r != null && r.toLowerCase().contains(marker))
                   || (m != null && m.toLowerCase().contains(marker));
        }
        return false;
    }
}
