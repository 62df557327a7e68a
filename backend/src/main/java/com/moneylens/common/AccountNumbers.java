package com.moneylens.common;

/**
 * Account identifier normalization for exact matching.
 * Bank exports group account numbers differently ("8327-9 123 456 789-0", "83279123456789 0");
 * only the digit sequence is significant.
 */
public final class AccountNumbers {

    private AccountNumbers() {
    }

    /**
     * Digits of the identifier in order, or null when it carries no digits.
     */
    public static String normalize(String accountRef) {
        if (accountRef == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(accountRef.length());
        for (int i = 0; i < accountRef.length(); i++) {
            char c = accountRef.charAt(i);
            if (c >= '0' && c <= '9') {
                sb.append(c);
            }
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    /**
     * True when both identifiers normalize to the same non-empty digit sequence.
     */
    public static boolean sameAccount(String a, String b) {
        String na = normalize(a);
        return na != null && na.equals(normalize(b));
    }
}
