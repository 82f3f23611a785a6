package com.nyc311.cleaner.service;

import java.util.Comparator;

/**
 * Orders unique keys numerically when both parse as integers, otherwise as text.
 * Numeric keys sort before non-numeric ones. Distinct strings never compare equal.
 */
public final class UniqueKeyOrder implements Comparator<String> {

    public static final UniqueKeyOrder INSTANCE = new UniqueKeyOrder();

    private UniqueKeyOrder() {}

    @Override
    public int compare(String a, String b) {
        Long na = asLong(a);
        Long nb = asLong(b);
        if (na != null && nb != null) {
            int cmp = Long.compare(na, nb);
            return cmp != 0 ? cmp : a.compareTo(b);
        }
        if (na != null) return -1;
        if (nb != null) return 1;
        return a.compareTo(b);
    }

    private static Long asLong(String key) {
        try {
            return Long.parseLong(key.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
