package com.flagship.bounty_ledger.collaborator.solana;

import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Form check for payout addresses: base58 text decoding to a 32-byte public key.
 * Says nothing about whether the account exists.
 */
@Component
public class PayoutAddressValidator {

    private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    private static final BigInteger BASE = BigInteger.valueOf(58);
    private static final int PUBLIC_KEY_LENGTH = 32;

    public boolean isValid(String address) {
        if (address == null || address.isEmpty() || address.length() > 44) {
            return false;
        }
        byte[] decoded = decodeBase58(address);
        return decoded != null && decoded.length == PUBLIC_KEY_LENGTH;
    }

    /**
     * Returns null when the text contains a character outside the base58 alphabet.
     */
    static byte[] decodeBase58(String text) {
        BigInteger value = BigInteger.ZERO;
        int leadingZeros = 0;
        boolean leading = true;
        for (char c : text.toCharArray()) {
            int digit = ALPHABET.indexOf(c);
            if (digit < 0) {
                return null;
            }
            if (leading && digit == 0) {
                leadingZeros++;
            } else {
                leading = false;
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }

        byte[] magnitude = value.signum() == 0 ? new byte[0] : value.toByteArray();
        int offset = magnitude.length > 0 && magnitude[0] == 0 ? 1 : 0;
        int length = magnitude.length - offset;

        byte[] result = new byte[leadingZeros + length];
        System.arraycopy(magnitude, offset, result, leadingZeros, length);
        return result;
    }
}
