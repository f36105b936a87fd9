package com.fintech.escrow.ledger;

import org.web3j.crypto.WalletUtils;

import java.util.Locale;

/**
 * Address helpers. Addresses are compared in lower-case 0x form.
 */
public final class LedgerAddresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    private LedgerAddresses() {
    }

    public static boolean isValid(String address) {
        return address != null && address.startsWith("0x") && WalletUtils.isValidAddress(address);
    }

    public static boolean isZero(String address) {
        return address == null || ZERO.equals(normalize(address));
    }

    /**
     * @throws IllegalArgumentException if the value is not a 20-byte hex address
     */
    public static String normalize(String address) {
        if (!isValid(address)) {
            throw new IllegalArgumentException("Invalid ledger address: " + address);
        }
        return address.toLowerCase(Locale.ROOT);
    }

    public static boolean same(String left, String right) {
        if (left == null || right == null) {
            return false;
        }
        return left.equalsIgnoreCase(right);
    }
}
