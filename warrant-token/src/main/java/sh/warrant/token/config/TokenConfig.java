// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token.config;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.warrant.core.error.ConfigException;
import sh.warrant.core.types.Address;

/**
 * Deployment settings of one token instance.
 *
 * <p>Loaded from JSON:
 * <pre>{@code
 * {
 *   "name": "Token",
 *   "version": "1",
 *   "symbol": "TOK",
 *   "decimals": 4,
 *   "totalSupply": "10000000",
 *   "chainId": 1,
 *   "verifyingContract": "0x..."
 * }
 * }</pre>
 *
 * <p>{@code chainId} defaults to 1. {@code verifyingContract} is optional; when absent
 * the deployment derives an address for the instance.
 *
 * @param name              token name, also the EIP-712 domain name
 * @param version           EIP-712 domain version
 * @param symbol            ticker symbol
 * @param decimals          display decimals, 0 to 255
 * @param totalSupply       supply minted to the deployer, in smallest units
 * @param chainId           chain identifier bound into the domain
 * @param verifyingContract instance address bound into the domain, or null to derive one
 * @since 0.1.0
 */
public record TokenConfig(
    String name,
    String version,
    String symbol,
    int decimals,
    BigInteger totalSupply,
    BigInteger chainId,
    @Nullable Address verifyingContract
) {

    /** Chain identifier used when none is configured. */
    public static final BigInteger DEFAULT_CHAIN_ID = BigInteger.ONE;

    private static final int MAX_DECIMALS = 255;

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public TokenConfig {
        if (chainId == null) {
            chainId = DEFAULT_CHAIN_ID;
        }
        List<String> problems = problems(name, version, symbol, decimals, totalSupply, chainId);
        if (!problems.isEmpty()) {
            throw ConfigException.invalid(problems);
        }
    }

    private static List<String> problems(
            @Nullable String name, @Nullable String version, @Nullable String symbol,
            @Nullable Integer decimals, @Nullable BigInteger totalSupply, @Nullable BigInteger chainId) {
        List<String> problems = new ArrayList<>();
        if (name == null || name.isBlank()) problems.add("name is required");
        if (version == null || version.isBlank()) problems.add("version is required");
        if (symbol == null || symbol.isBlank()) problems.add("symbol is required");
        if (decimals == null) {
            problems.add("decimals is required");
        } else if (decimals < 0 || decimals > MAX_DECIMALS) {
            problems.add("decimals must be between 0 and " + MAX_DECIMALS + ", got " + decimals);
        }
        if (totalSupply == null) {
            problems.add("totalSupply is required");
        } else if (totalSupply.signum() < 0) {
            problems.add("totalSupply must be non-negative, got " + totalSupply);
        }
        if (chainId != null && chainId.signum() < 0) {
            problems.add("chainId must be non-negative, got " + chainId);
        }
        return problems;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ═══════════════════════════════════════════════════════════════
    // JSON loading
    // ═══════════════════════════════════════════════════════════════

    /**
     * Parses a configuration from JSON.
     *
     * @param json the JSON document
     * @return the validated configuration
     * @throws ConfigException if the JSON is malformed or a setting is missing or invalid
     */
    public static TokenConfig fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            return MAPPER.readValue(json, Document.class).toConfig();
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid token configuration JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a configuration file.
     *
     * @param path the JSON file
     * @return the validated configuration
     * @throws ConfigException if the file cannot be read or is invalid
     */
    public static TokenConfig load(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new ConfigException("Cannot read token configuration " + path, e);
        }
    }

    /**
     * Reads a configuration from the classpath.
     *
     * @param resource resource name, e.g. {@code "token.json"}
     * @return the validated configuration
     * @throws ConfigException if the resource is missing or invalid
     */
    public static TokenConfig loadResource(String resource) {
        Objects.requireNonNull(resource, "resource");
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = TokenConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigException("Token configuration resource not found: " + resource);
            }
            return MAPPER.readValue(in, Document.class).toConfig();
        } catch (JsonProcessingException e) {
            throw new ConfigException("Invalid token configuration JSON in " + resource + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigException("Cannot read token configuration " + resource, e);
        }
    }

    /**
     * JSON shape before validation; every field may be missing.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Document(
        @Nullable String name,
        @Nullable String version,
        @Nullable String symbol,
        @Nullable Integer decimals,
        @Nullable BigInteger totalSupply,
        @Nullable BigInteger chainId,
        @Nullable String verifyingContract
    ) {
        TokenConfig toConfig() {
            List<String> problems = problems(name, version, symbol, decimals, totalSupply, chainId);
            if (!problems.isEmpty()) {
                throw ConfigException.invalid(problems);
            }
            Address contract;
            try {
                contract = verifyingContract == null ? null : new Address(verifyingContract);
            } catch (IllegalArgumentException e) {
                throw new ConfigException("verifyingContract is not a valid address: " + verifyingContract, e);
            }
            return new TokenConfig(name, version, symbol, decimals, totalSupply, chainId, contract);
        }
    }

    /**
     * Builder for {@link TokenConfig}.
     */
    public static final class Builder {
        private @Nullable String name;
        private @Nullable String version;
        private @Nullable String symbol;
        private @Nullable Integer decimals;
        private @Nullable BigInteger totalSupply;
        private BigInteger chainId = DEFAULT_CHAIN_ID;
        private @Nullable Address verifyingContract;

        Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder decimals(int decimals) {
            this.decimals = decimals;
            return this;
        }

        public Builder totalSupply(BigInteger totalSupply) {
            this.totalSupply = totalSupply;
            return this;
        }

        public Builder totalSupply(long totalSupply) {
            return totalSupply(BigInteger.valueOf(totalSupply));
        }

        public Builder chainId(long chainId) {
            this.chainId = BigInteger.valueOf(chainId);
            return this;
        }

        public Builder verifyingContract(@Nullable Address verifyingContract) {
            this.verifyingContract = verifyingContract;
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @return the configuration
         * @throws ConfigException listing every invalid setting
         */
        public TokenConfig build() {
            List<String> problems = problems(name, version, symbol, decimals, totalSupply, chainId);
            if (!problems.isEmpty()) {
                throw ConfigException.invalid(problems);
            }
            return new TokenConfig(name, version, symbol, decimals, totalSupply, chainId, verifyingContract);
        }
    }
}
