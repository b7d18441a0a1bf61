package com.chicu.rebalancer.bot.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TelegramText Tests")
class TelegramTextTest {

    @Test
    @DisplayName("HTML special characters are escaped and restored")
    void testEscapeAndStrip() {
        String escaped = TelegramText.escapeHtml("balance < threshold & 1 > 0");
        assertEquals("balance &lt; threshold &amp; 1 &gt; 0", escaped);
        assertEquals("bold balance < threshold & 1 > 0", TelegramText.stripHtml("<b>bold</b> " + escaped));
        assertEquals("", TelegramText.escapeHtml(null));
    }

    @Test
    @DisplayName("Pagination prefers line breaks and keeps every character")
    void testPaginate() {
        String text = "line-1\nline-2\nline-3\n";
        List<String> parts = TelegramText.paginate(text, 10);

        assertEquals(List.of("line-1\n", "line-2\n", "line-3\n"), parts);
        assertEquals(text, String.join("", parts));
    }

    @Test
    @DisplayName("Long lines without breaks are cut at the limit")
    void testPaginateHardCut() {
        List<String> parts = TelegramText.paginate("x".repeat(25), 10);

        assertEquals(3, parts.size());
        assertTrue(parts.stream().allMatch(p -> p.length() <= 10));
        assertTrue(TelegramText.paginate("", 10).isEmpty());
    }

    @Test
    @DisplayName("Telegram API errors are recognised by their description")
    void testErrorDetection() {
        TelegramApiRequestException parse = new TelegramApiRequestException("Bad Request: can't parse entities: unexpected end tag");
        TelegramApiRequestException tooLong = new TelegramApiRequestException("Bad Request: message is too long");

        assertTrue(TelegramText.isParseError(parse));
        assertFalse(TelegramText.isTooLongError(parse));
        assertTrue(TelegramText.isTooLongError(tooLong));
        assertFalse(TelegramText.isParseError(new IllegalStateException("can't parse entities")));
    }
}
