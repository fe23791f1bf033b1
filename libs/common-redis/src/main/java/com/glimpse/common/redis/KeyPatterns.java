package com.glimpse.common.redis;

import java.util.regex.Pattern;

/**
 * Redis-style glob matching for key patterns.
 */
public final class KeyPatterns {

    private KeyPatterns() {
    }

    public static Pattern compile(String glob) {
        StringBuilder sb = new StringBuilder(glob.length() + 8);
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                sb.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
                continue;
            }
            if (inClass) {
                if (c == ']') {
                    inClass = false;
                }
                sb.append(c);
                continue;
            }
            switch (c) {
                case '*' -> sb.append(".*");
                case '?' -> sb.append('.');
                case '[' -> {
                    inClass = true;
                    sb.append('[');
                    if (i + 1 < glob.length() && glob.charAt(i + 1) == '^') {
                        sb.append('^');
                        i++;
                    }
                }
                default -> sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(sb.toString(), Pattern.DOTALL);
    }

    public static boolean matches(String glob, String key) {
        return compile(glob).matcher(key).matches();
    }
}
