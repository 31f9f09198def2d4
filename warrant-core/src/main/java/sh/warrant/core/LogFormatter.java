// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core;

/**
 * Structured log message formatter.
 *
 * <p>
 * All formatters use the bracketed {@code [OPERATION]} layout and a status symbol
 * ({@code ✓} accepted, {@code ✗} rejected, {@code ○} undone). Long hex values are
 * shortened to {@code 0x1234...abcd}.
 *
 * <pre>{@code
 * log.debug(LogFormatter.formatAccepted("TRANSFER-AUTH", from, nonce, value));
 * // ✓ [TRANSFER-AUTH] authorizer=0xf39f...2266 nonce=0x1a2b...3c4d value=7000000
 * }</pre>
 *
 * <p>
 * All methods are pure functions and thread-safe.
 *
 * @since 0.1.0
 */
public final class LogFormatter {

    /**
     * Characters kept at the start of a shortened value, including the "0x" prefix.
     */
    private static final int HASH_PREFIX_LENGTH = 6;

    /**
     * Characters kept at the end of a shortened value.
     */
    private static final int HASH_SUFFIX_LENGTH = 4;

    /**
     * Values this short or shorter are shown in full.
     */
    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: ✓ [OPERATION] authorizer=0x1234...5678 nonce=0xabcd...ef01 value=100
     * <p>
     * {@code value} may be null for operations that move no funds.
     */
    public static String formatAccepted(String operation, Object authorizer, Object nonce, Object value) {
        final String base = String.format(
                "✓ [%s] authorizer=%s nonce=%s",
                operation,
                shorten(String.valueOf(authorizer)),
                shorten(String.valueOf(nonce)));
        return value == null ? base : base + " value=" + value;
    }

    /**
     * Format: ✗ [OPERATION] authorizer=0x1234...5678 nonce=0xabcd...ef01 reason=authorization is expired
     */
    public static String formatRejected(String operation, Object authorizer, Object nonce, String reason) {
        return String.format(
                "✗ [%s] authorizer=%s nonce=%s reason=%s",
                operation,
                shorten(String.valueOf(authorizer)),
                shorten(String.valueOf(nonce)),
                reason);
    }

    /**
     * Format: ○ [ROLLBACK] operation=TRANSFER-AUTH authorizer=0x1234...5678 nonce=0xabcd...ef01 cause=...
     */
    public static String formatRollback(String operation, Object authorizer, Object nonce, String cause) {
        return String.format(
                "○ [ROLLBACK] operation=%s authorizer=%s nonce=%s cause=%s",
                operation,
                shorten(String.valueOf(authorizer)),
                shorten(String.valueOf(nonce)),
                cause);
    }

    /**
     * Format: ✓ [TRANSFER] from=0x1234...5678 to=0xabcd...ef01 value=100
     */
    public static String formatTransfer(Object from, Object to, Object value) {
        return String.format(
                "✓ [TRANSFER] from=%s to=%s value=%s",
                shorten(String.valueOf(from)),
                shorten(String.valueOf(to)),
                value);
    }

    /**
     * Format: ✓ [DEPLOY] name=Token version=1 symbol=TOK decimals=4 totalSupply=10000000
     * contract=0x1234...5678 chainId=1
     */
    public static String formatDeploy(
            String name, String version, String symbol, int decimals, Object totalSupply,
            Object contract, Object chainId) {
        return String.format(
                "✓ [DEPLOY] name=%s version=%s symbol=%s decimals=%d totalSupply=%s contract=%s chainId=%s",
                name, version, symbol, decimals, totalSupply, shorten(String.valueOf(contract)), chainId);
    }

    /**
     * Shortens a hex value to a readable format: {@code 0xabcd...ef12}.
     *
     * @param fullHash the value to shorten
     * @return the shortened value, or the original if null or already short enough
     */
    public static String shorten(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
