package com.ryuqq.wsclient.core.config;

import java.util.Locale;

/**
 * 메시지 키 → XML 요소 이름 변환 규칙.
 *
 * <p>예: {@code user_name} → LOWER_CAMELCASE {@code userName}, CAMELCASE {@code UserName},
 * UPCASE {@code USER_NAME}, NONE {@code user_name}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum KeyConverter {

    LOWER_CAMELCASE,
    CAMELCASE,
    UPCASE,
    NONE;

    /**
     * 옵션 값으로 조회 ({@code lower_camelcase}, {@code camelcase}, {@code upcase}, {@code none}).
     *
     * @param name 옵션 값
     * @return KeyConverter
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static KeyConverter of(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("key converter name cannot be null or blank");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * 키 변환.
     *
     * @param key 원본 키
     * @return 변환된 요소 이름
     */
    public String convert(String key) {
        switch (this) {
            case UPCASE:
                return key.toUpperCase(Locale.ROOT);
            case NONE:
                return key;
            default:
                return camelize(key, this == CAMELCASE);
        }
    }

    private static String camelize(String key, boolean upperFirst) {
        StringBuilder result = new StringBuilder(key.length());
        boolean upperNext = upperFirst;
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == '_') {
                upperNext = result.length() > 0 || upperFirst;
                continue;
            }
            if (upperNext) {
                result.append(Character.toUpperCase(c));
                upperNext = false;
            } else if (result.length() == 0 && !upperFirst) {
                result.append(Character.toLowerCase(c));
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}
