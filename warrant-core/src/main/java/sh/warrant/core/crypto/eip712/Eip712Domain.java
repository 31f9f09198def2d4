// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto.eip712;

import java.math.BigInteger;
import java.util.Objects;

import sh.warrant.core.types.Address;
import sh.warrant.core.types.Hash;

/**
 * EIP-712 signing domain of one token instance.
 * <p>
 * All four fields are required: the domain separator is always computed over
 * {@value Eip712#DOMAIN_TYPE}. Identical messages signed under two domains that
 * differ in any field produce different digests.
 *
 * @param name              the token name
 * @param version           the signing domain version
 * @param chainId           the chain identifier (uint256)
 * @param verifyingContract the address of the token instance that verifies signatures
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 * @since 0.1.0
 */
public record Eip712Domain(
        String name,
        String version,
        BigInteger chainId,
        Address verifyingContract
) {

    public Eip712Domain {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(chainId, "chainId");
        Objects.requireNonNull(verifyingContract, "verifyingContract");
        if (chainId.signum() < 0) {
            throw new IllegalArgumentException("chainId cannot be negative: " + chainId);
        }
    }

    /**
     * Creates a new builder for constructing an Eip712Domain.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Computes the domain separator hash.
     * <p>
     * {@code keccak256(typeHash(EIP712Domain) || keccak(name) || keccak(version) || chainId || verifyingContract)}
     *
     * @return the 32-byte domain separator
     * @see <a href="https://eips.ethereum.org/EIPS/eip-712#definition-of-domainseparator">EIP-712 Domain Separator</a>
     */
    public Hash separator() {
        return Eip712.domainSeparator(name, version, chainId, verifyingContract);
    }

    /**
     * Builder for constructing Eip712Domain instances.
     */
    public static final class Builder {
        private String name;
        private String version;
        private BigInteger chainId;
        private Address verifyingContract;

        Builder() {}

        /**
         * Sets the token name.
         *
         * @param name the name
         * @return this builder
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Sets the signing domain version.
         *
         * @param version the version
         * @return this builder
         */
        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /**
         * Sets the chain identifier.
         *
         * @param chainId the chain ID
         * @return this builder
         */
        public Builder chainId(long chainId) {
            this.chainId = BigInteger.valueOf(chainId);
            return this;
        }

        /**
         * Sets the chain identifier.
         *
         * @param chainId the chain ID
         * @return this builder
         */
        public Builder chainId(BigInteger chainId) {
            this.chainId = chainId;
            return this;
        }

        /**
         * Sets the verifying token instance.
         *
         * @param verifyingContract the token address
         * @return this builder
         */
        public Builder verifyingContract(Address verifyingContract) {
            this.verifyingContract = verifyingContract;
            return this;
        }

        /**
         * Builds the Eip712Domain instance.
         *
         * @return the constructed Eip712Domain
         * @throws NullPointerException if a field was not set
         */
        public Eip712Domain build() {
            return new Eip712Domain(name, version, chainId, verifyingContract);
        }
    }
}
