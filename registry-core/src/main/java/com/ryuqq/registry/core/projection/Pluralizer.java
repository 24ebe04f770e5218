package com.ryuqq.registry.core.projection;

/**
 * 속성 이름의 복수형 변환.
 *
 * <p><strong>규칙 (순서대로 적용):</strong></p>
 * <ol>
 *   <li>"s"로 끝나면 그대로 반환 (이미 복수형으로 간주)</li>
 *   <li>자음 + "y"로 끝나면 "y"를 "ies"로 치환 (category → categories)</li>
 *   <li>"sh", "ch", "x", "z"로 끝나면 "es" 추가 (box → boxes)</li>
 *   <li>그 외에는 "s" 추가 (id → ids)</li>
 * </ol>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class Pluralizer {

    private static final String VOWELS = "aeiou";

    // Utility class - prevent instantiation
    private Pluralizer() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단어의 복수형 반환.
     *
     * @param word 단수형 단어
     * @return 복수형 단어
     * @throws IllegalArgumentException word가 null인 경우
     */
    public static String pluralize(String word) {
        if (word == null) {
            throw new IllegalArgumentException("word cannot be null");
        }
        if (word.endsWith("s")) {
            return word;
        }
        if (word.endsWith("y") && word.length() > 1
                && VOWELS.indexOf(Character.toLowerCase(word.charAt(word.length() - 2))) < 0) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (word.endsWith("sh") || word.endsWith("ch") || word.endsWith("x") || word.endsWith("z")) {
            return word + "es";
        }
        return word + "s";
    }
}
