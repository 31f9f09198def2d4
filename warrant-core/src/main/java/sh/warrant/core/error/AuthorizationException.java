// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.error;

import java.util.Objects;

import sh.warrant.core.types.Address;
import sh.warrant.core.types.Nonce;

/**
 * Thrown when a signed authorization is rejected before any state changes.
 * <p>
 * Every rejection carries a {@link Reason}, so callers can tell an expired
 * authorization from a replayed one without parsing messages. The messages
 * themselves match the revert strings of the reference token contract
 * (for example {@code "authorization is expired"}).
 * <p>
 * This class is {@code non-sealed} so that hosts embedding the engine can
 * attach their own context in a subclass.
 *
 * @since 0.1.0
 */
public non-sealed class AuthorizationException extends WarrantException {

    /** Why an authorization was rejected. */
    public enum Reason {
        /** Signature is malformed or was not produced by the claimed signer over these exact fields. */
        INVALID_SIGNATURE("invalid signature"),
        /** Current time is before {@code validAfter}. */
        AUTHORIZATION_NOT_YET_VALID("authorization is not yet valid"),
        /** Current time is at or after {@code validBefore}. */
        AUTHORIZATION_EXPIRED("authorization is expired"),
        /** The (signer, nonce) pair was already used or canceled. */
        AUTHORIZATION_ALREADY_USED("authorization is used or canceled"),
        /** A receive-style authorization was submitted by someone other than the payee. */
        CALLER_NOT_PAYEE("caller must be the payee");

        private final String description;

        Reason(final String description) {
            this.description = description;
        }

        /**
         * Returns the human-readable rejection text.
         *
         * @return the description
         */
        public String description() {
            return description;
        }
    }

    private final Reason reason;

    public AuthorizationException(final Reason reason, final String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public AuthorizationException(final Reason reason, final String message, final Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    /**
     * Returns the rejection reason.
     *
     * @return the reason, never null
     */
    public Reason reason() {
        return reason;
    }

    // ═══════════════════════════════════════════════════════════════
    // Factory methods
    // ═══════════════════════════════════════════════════════════════

    public static AuthorizationException invalidSignature() {
        return of(Reason.INVALID_SIGNATURE);
    }

    public static AuthorizationException invalidSignature(final String detail) {
        return new AuthorizationException(Reason.INVALID_SIGNATURE,
            Reason.INVALID_SIGNATURE.description() + ": " + detail);
    }

    public static AuthorizationException invalidSignature(final String detail, final Throwable cause) {
        return new AuthorizationException(Reason.INVALID_SIGNATURE,
            Reason.INVALID_SIGNATURE.description() + ": " + detail, cause);
    }

    public static AuthorizationException notYetValid() {
        return of(Reason.AUTHORIZATION_NOT_YET_VALID);
    }

    public static AuthorizationException expired() {
        return of(Reason.AUTHORIZATION_EXPIRED);
    }

    public static AuthorizationException alreadyUsed(final Address authorizer, final Nonce nonce) {
        return new AuthorizationException(Reason.AUTHORIZATION_ALREADY_USED,
            "%s (authorizer=%s, nonce=%s)".formatted(
                Reason.AUTHORIZATION_ALREADY_USED.description(), authorizer.value(), nonce.value()));
    }

    public static AuthorizationException callerNotPayee(final Address caller, final Address payee) {
        return new AuthorizationException(Reason.CALLER_NOT_PAYEE,
            "%s (caller=%s, payee=%s)".formatted(
                Reason.CALLER_NOT_PAYEE.description(), caller.value(), payee.value()));
    }

    private static AuthorizationException of(final Reason reason) {
        return new AuthorizationException(reason, reason.description());
    }
}
