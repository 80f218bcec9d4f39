package com.lendmatch.domain;

import java.util.regex.Pattern;

/**
 * Account address helpers. Addresses are opaque strings; the all-zero EVM address,
 * null and blank strings all count as the zero address.
 */
public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private static final Pattern ZERO_HEX = Pattern.compile("^(0x)?0+$", Pattern.CASE_INSENSITIVE);

    private Addresses() {}

    public static boolean isZero(String address) {
        return address == null || address.isBlank() || ZERO_HEX.matcher(address.trim()).matches();
    }
}
