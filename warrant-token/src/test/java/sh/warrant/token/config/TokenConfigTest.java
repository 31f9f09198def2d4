// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token.config;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import sh.warrant.core.error.ConfigException;
import sh.warrant.core.types.Address;

class TokenConfigTest {

    @Test
    void loadsClasspathResource() {
        TokenConfig config = TokenConfig.loadResource("token.json");

        assertEquals("Token", config.name());
        assertEquals("1", config.version());
        assertEquals("TOK", config.symbol());
        assertEquals(4, config.decimals());
        assertEquals(BigInteger.valueOf(10_000_000), config.totalSupply());
        assertEquals(BigInteger.ONE, config.chainId());
        assertEquals(new Address("0x5fbdb2315678afecb367f032d93f642f64180aa3"), config.verifyingContract());
    }

    @Test
    void reportsEveryProblem() {
        var ex = assertThrows(ConfigException.class, () -> TokenConfig.loadResource("token-invalid.json"));

        String message = ex.getMessage();
        assertTrue(message.startsWith("Invalid token configuration: "), message);
        assertTrue(message.contains("name is required"), message);
        assertTrue(message.contains("symbol is required"), message);
        assertTrue(message.contains("decimals must be between 0 and 255, got 300"), message);
        assertTrue(message.contains("totalSupply must be non-negative, got -5"), message);
        assertFalse(message.contains("version"), message);
    }

    @Test
    void chainIdDefaultsAndContractIsOptional() {
        TokenConfig config = TokenConfig.fromJson(
            "{\"name\":\"Token\",\"version\":\"1\",\"symbol\":\"TOK\",\"decimals\":6,\"totalSupply\":1000}");

        assertEquals(TokenConfig.DEFAULT_CHAIN_ID, config.chainId());
        assertNull(config.verifyingContract());
    }

    @Test
    void missingDecimalsIsReported() {
        var ex = assertThrows(ConfigException.class, () -> TokenConfig.fromJson(
            "{\"name\":\"Token\",\"version\":\"1\",\"symbol\":\"TOK\",\"totalSupply\":1000}"));
        assertTrue(ex.getMessage().contains("decimals is required"));
    }

    @Test
    void rejectsMalformedJsonAndBadAddress() {
        var malformed = assertThrows(ConfigException.class, () -> TokenConfig.fromJson("{\"name\":"));
        assertTrue(malformed.getMessage().startsWith("Invalid token configuration JSON"));

        var badAddress = assertThrows(ConfigException.class, () -> TokenConfig.fromJson(
            "{\"name\":\"Token\",\"version\":\"1\",\"symbol\":\"TOK\",\"decimals\":6,\"totalSupply\":1,"
                + "\"verifyingContract\":\"0x1234\"}"));
        assertTrue(badAddress.getMessage().startsWith("verifyingContract is not a valid address"));
    }

    @Test
    void missingResourceIsConfigError() {
        var ex = assertThrows(ConfigException.class, () -> TokenConfig.loadResource("absent.json"));
        assertEquals("Token configuration resource not found: absent.json", ex.getMessage());
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("token.json");
        Files.writeString(file,
            "{\"name\":\"Gold\",\"version\":\"2\",\"symbol\":\"GLD\",\"decimals\":18,\"totalSupply\":\"5\",\"chainId\":8453}");

        TokenConfig config = TokenConfig.load(file);

        assertEquals("Gold", config.name());
        assertEquals(BigInteger.valueOf(8453), config.chainId());
        assertThrows(ConfigException.class, () -> TokenConfig.load(dir.resolve("missing.json")));
    }

    @Test
    void builderRequiresDecimals() {
        var ex = assertThrows(ConfigException.class, () -> TokenConfig.builder()
            .name("Token").version("1").symbol("TOK").totalSupply(10_000_000L)
            .build());

        assertEquals("Invalid token configuration: decimals is required", ex.getMessage());
    }

    @Test
    void builderValidates() {
        TokenConfig config = TokenConfig.builder()
            .name("Token").version("1").symbol("TOK").decimals(4).totalSupply(10_000_000L).chainId(5L)
            .build();
        assertEquals(BigInteger.valueOf(5), config.chainId());

        assertThrows(ConfigException.class, () -> TokenConfig.builder().name("Token").build());
    }
}
