package com.ryuqq.propcheck.core.domain;

import com.ryuqq.propcheck.core.seed.Seed;

import java.util.SplittableRandom;

/**
 * 식별자 형태 문자열 도메인.
 *
 * <p>첫 글자는 {@code [_A-Za-z]}, 이후 글자는 숫자를 포함합니다.
 * 길이는 [minLength, maxLength]에서 균등하게 뽑습니다.</p>
 *
 * @author PropCheck Team
 * @since 1.0.0
 */
final class IdentifierDomain implements Domain<String> {

    private static final String HEAD_CHARS =
        "_abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String TAIL_CHARS = HEAD_CHARS + "0123456789";

    private final int minLength;
    private final int maxLength;

    IdentifierDomain(int minLength, int maxLength) {
        if (minLength < 1) {
            throw new IllegalArgumentException(
                "minLength must be at least 1 (current: " + minLength + ")"
            );
        }
        if (maxLength < minLength) {
            throw new IllegalArgumentException(
                "maxLength must be >= minLength (min: " + minLength + ", max: " + maxLength + ")"
            );
        }
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    @Override
    public String draw(Seed seed, DrawContext context) {
        SplittableRandom random = seed.newRandom();
        int length = random.nextInt(minLength, maxLength + 1);
        StringBuilder builder = new StringBuilder(length);
        builder.append(HEAD_CHARS.charAt(random.nextInt(HEAD_CHARS.length())));
        for (int i = 1; i < length; i++) {
            builder.append(TAIL_CHARS.charAt(random.nextInt(TAIL_CHARS.length())));
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return "Identifiers[" + minLength + ".." + maxLength + "]";
    }
}
