package com.raava.concierge.util;

import java.util.Locale;

/**
 * Formats pound sterling amounts for user-facing text.
 */
public class MoneyFormatter {

    private MoneyFormatter() {}

    /** £189,500 */
    public static String whole(double amount) {
        return String.format(Locale.UK, "£%,.0f", amount);
    }

    /** £3,012.07 */
    public static String exact(double amount) {
        return String.format(Locale.UK, "£%,.2f", amount);
    }
}
