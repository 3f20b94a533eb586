package ai.freetranslator.token;

import java.util.Objects;

/**
 * The checksum computed by the translation site's own JavaScript. The arithmetic is 32-bit signed, matching the
 * browser, and the text is walked as UTF-16 code units expanded to UTF-8 style bytes.
 */
public class TkkTokenFunction implements TokenFunction {

    private static final String ROUND_SALT = "+-a^+6";
    private static final String FINAL_SALT = "+-3^+b+-f";

    @Override
    public String apply(TokenSeed seed, String text) {
        Objects.requireNonNull(seed, "seed");
        Objects.requireNonNull(text, "text");
        int base = (int) seed.first();
        int a = base;
        for (int value : expand(text)) {
            a += value;
            a = mix(a, ROUND_SALT);
        }
        a = mix(a, FINAL_SALT);
        a ^= (int) seed.second();
        long unsigned = a & 0xFFFFFFFFL;
        long folded = unsigned % 1_000_000L;
        return folded + "." + (folded ^ base);
    }

    static int mix(int a, String salt) {
        for (int i = 0; i < salt.length() - 2; i += 3) {
            char amountChar = salt.charAt(i + 2);
            int amount = amountChar >= 'a' ? amountChar - 87 : amountChar - '0';
            int shifted = salt.charAt(i + 1) == '+' ? a >>> amount : a << amount;
            a = salt.charAt(i) == '+' ? a + shifted : a ^ shifted;
        }
        return a;
    }

    static int[] expand(String text) {
        int[] bytes = new int[text.length() * 3];
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            int unit = text.charAt(i);
            if (unit < 0x80) {
                bytes[count++] = unit;
                continue;
            }
            if (unit < 0x800) {
                bytes[count++] = unit >> 6 | 0xC0;
            } else {
                if (Character.isHighSurrogate((char) unit) && i + 1 < text.length()
                        && Character.isLowSurrogate(text.charAt(i + 1))) {
                    unit = Character.toCodePoint((char) unit, text.charAt(++i));
                    bytes[count++] = unit >> 18 | 0xF0;
                    bytes[count++] = unit >> 12 & 0x3F | 0x80;
                } else {
                    bytes[count++] = unit >> 12 | 0xE0;
                }
                bytes[count++] = unit >> 6 & 0x3F | 0x80;
            }
            bytes[count++] = unit & 0x3F | 0x80;
        }
        int[] result = new int[count];
        System.arraycopy(bytes, 0, result, 0, count);
        return result;
    }
}
