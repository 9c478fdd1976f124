package com.linlay.agentteam.tool;

import java.util.Locale;
import java.util.Map;

final class ToolOptions {

    private ToolOptions() {
    }

    static boolean flag(Map<String, Object> options, String key, boolean fallback) {
        Object value = options == null ? null : options.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        if (value instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized) || "yes".equals(normalized) || "1".equals(normalized)) {
                return true;
            }
            if ("false".equals(normalized) || "no".equals(normalized) || "0".equals(normalized)) {
                return false;
            }
        }
        return fallback;
    }

    static int positiveInt(Map<String, Object> options, String key, int fallback) {
        Object value = options == null ? null : options.get(key);
        int parsed = fallback;
        if (value instanceof Number number) {
            parsed = number.intValue();
        } else if (value instanceof String text) {
            try {
                parsed = Integer.parseInt(text.trim());
            } catch (NumberFormatException ex) {
                parsed = fallback;
            }
        }
        return parsed > 0 ? parsed : fallback;
    }

    static String text(Map<String, Object> args, String key) {
        Object value = args == null ? null : args.get(key);
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }
}
