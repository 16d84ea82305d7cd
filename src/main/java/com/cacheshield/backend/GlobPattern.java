package com.cacheshield.backend;

import java.util.regex.Pattern;

/**
 * Redis 风格通配符（* ?）转正则
 */
public final class GlobPattern {

    private GlobPattern() {}

    public static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> {
                    if ("\\.[]{}()<>+-=!^$|".indexOf(c) >= 0) {
                        regex.append('\\');
                    }
                    regex.append(c);
                }
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    /**
     * 通配符之前的固定前缀，用于按前缀路由后端
     */
    public static String literalPrefix(String glob) {
        int end = glob.length();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                end = i;
                break;
            }
        }
        return glob.substring(0, end);
    }
}
