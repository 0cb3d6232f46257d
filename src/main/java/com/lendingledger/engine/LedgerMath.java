package com.lendingledger.engine;

import com.lendingledger.exception.ErrorCode;
import com.lendingledger.exception.LedgerException;
import java.util.Map;

/**
 * Overflow-checked arithmetic over non-negative ledger quantities.
 *
 * <p>Any result that does not fit in a {@code long} (or would go negative on subtraction)
 * is rejected with {@link ErrorCode#INVALID_AMOUNT}. Callers evaluate every product and
 * sum before touching ledger state, so an overflow always aborts the operation cleanly.
 */
public final class LedgerMath {

    private LedgerMath() {}

    public static long multiply(long a, long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw new LedgerException(
                    ErrorCode.INVALID_AMOUNT, "Arithmetic overflow: " + a + " * " + b, e);
        }
    }

    public static long add(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new LedgerException(ErrorCode.INVALID_AMOUNT, "Arithmetic overflow: " + a + " + " + b, e);
        }
    }

    public static long subtract(long a, long b) {
        if (b > a) {
            throw new LedgerException(
                    ErrorCode.INVALID_AMOUNT,
                    "Arithmetic underflow: " + a + " - " + b,
                    Map.of("minuend", a, "subtrahend", b));
        }
        return a - b;
    }
}
