package com.tripmatch.pojo.model;

import java.util.Locale;

public enum Continent {

    AFRICA,
    ASIA,
    EUROPE,
    NORTH_AND_CENTRAL_AMERICA,
    SOUTH_AMERICA,
    OCEANIA,
    ANTARCTICA;

    /**
     * 兼容前端展示名（"North & Central America"）、旧枚举名（"NORTH_AMERICA"）与大写枚举名。
     *
     * @return 对应的大洲；无法识别时返回 null
     */
    public static Continent fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String normalized = label.trim()
                .toUpperCase(Locale.ROOT)
                .replace("&", "AND")
                .replaceAll("\\s+", "_");
        if ("NORTH_AMERICA".equals(normalized) || "CENTRAL_AMERICA".equals(normalized)) {
            return NORTH_AND_CENTRAL_AMERICA;
        }
        for (Continent c : values()) {
            if (c.name().equals(normalized)) {
                return c;
            }
        }
        return null;
    }
}
