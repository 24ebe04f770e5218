package com.ryuqq.registry.core.schema;

/**
 * projection 이름 문법 검증.
 *
 * <p>유효한 식별자: 첫 글자는 문자 또는 언더스코어(_), 이후는 문자, 숫자, 언더스코어만 허용.
 * 빈 문자열과 숫자로만 이루어진 이름은 허용하지 않습니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
final class Identifiers {

    // Utility class - prevent instantiation
    private Identifiers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static boolean isValid(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        int first = name.codePointAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return false;
        }
        return name.codePoints()
            .skip(1)
            .allMatch(cp -> Character.isLetterOrDigit(cp) || cp == '_');
    }
}
