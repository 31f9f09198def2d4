// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.error;

/**
 * Base runtime exception for all Warrant failures.
 *
 * <p>
 * This sealed class forms the root of the exception hierarchy, so every
 * Warrant-specific error can be caught with a single catch clause while the
 * set of direct subtypes stays closed.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * WarrantException
 * ├── {@link Eip712Exception} - typed-data encoding failures
 * ├── {@link AuthorizationException} - rejected authorizations (carries a {@link AuthorizationException.Reason})
 * ├── {@link LedgerException} - failures reported by the balance ledger
 * └── {@link ConfigException} - invalid token configuration
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     engine.transferWithAuthorization(auth, signature);
 * } catch (AuthorizationException e) {
 *     // Reject: e.reason() tells why
 * } catch (LedgerException e) {
 *     // Ledger refused the transfer; the nonce is still unused
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class WarrantException extends RuntimeException
        permits Eip712Exception,
        AuthorizationException,
        LedgerException,
        ConfigException {

    public WarrantException(final String message) {
        super(message);
    }

    public WarrantException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
