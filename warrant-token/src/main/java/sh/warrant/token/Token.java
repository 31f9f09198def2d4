// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.warrant.core.LogFormatter;
import sh.warrant.core.crypto.Keccak256;
import sh.warrant.core.crypto.Signature;
import sh.warrant.core.crypto.eip3009.CancelAuthorization;
import sh.warrant.core.crypto.eip3009.ReceiveAuthorization;
import sh.warrant.core.crypto.eip3009.TransferAuthorization;
import sh.warrant.core.crypto.eip712.Eip712;
import sh.warrant.core.crypto.eip712.Eip712Domain;
import sh.warrant.core.types.Address;
import sh.warrant.core.types.Hash;
import sh.warrant.core.types.Nonce;
import sh.warrant.token.config.TokenConfig;
import sh.warrant.token.event.TokenEvent;
import sh.warrant.token.event.TokenEventListener;
import sh.warrant.token.ledger.InMemoryLedger;

/**
 * A deployed token: metadata, balances and EIP-3009 authorizations.
 *
 * <pre>{@code
 * Token token = Token.deploy(TokenConfig.loadResource("token.json"), deployer, Clock.systemUTC());
 *
 * token.transfer(deployer, alice, BigInteger.valueOf(10_000_000));
 *
 * // alice signs off-chain; anyone relays
 * var auth = Eip3009.transferAuthorization(alice, bob, value, 3600);
 * var sig = Eip3009.sign(auth, token.domain(), aliceSigner);
 * token.transferWithAuthorization(auth, sig);
 * }</pre>
 *
 * <p>All balance and authorization operations go through one {@link AuthorizationEngine},
 * so direct transfers and authorized transfers are serialized against each other.
 *
 * @since 0.1.0
 */
public final class Token {

    private static final Logger log = LoggerFactory.getLogger(Token.class);

    private final TokenConfig config;
    private final Address address;
    private final AuthorizationEngine engine;

    Token(final TokenConfig config, final Address address, final AuthorizationEngine engine) {
        this.config = Objects.requireNonNull(config, "config");
        this.address = Objects.requireNonNull(address, "address");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Deploys a token backed by an {@link InMemoryLedger}, minting the supply to {@code deployer}.
     *
     * @param config    the token settings
     * @param deployer  the account receiving the total supply
     * @param clock     time source for validity windows
     * @param listeners listeners for committed events
     * @return the deployed token
     */
    public static Token deploy(
            final TokenConfig config, final Address deployer, final Clock clock,
            final TokenEventListener... listeners) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(deployer, "deployer");
        Objects.requireNonNull(clock, "clock");

        final Address address = config.verifyingContract() != null
                ? config.verifyingContract()
                : instanceAddress(deployer, config);
        final Eip712Domain domain = Eip712Domain.builder()
                .name(config.name())
                .version(config.version())
                .chainId(config.chainId())
                .verifyingContract(address)
                .build();

        final AuthorizationEngine.Builder builder = AuthorizationEngine.builder()
                .domain(domain)
                .ledger(new InMemoryLedger(deployer, config.totalSupply()))
                .clock(clock);
        for (TokenEventListener listener : listeners) {
            builder.listener(listener);
        }
        final Token token = new Token(config, address, builder.build());

        log.info(LogFormatter.formatDeploy(
                config.name(), config.version(), config.symbol(), config.decimals(),
                config.totalSupply(), address.value(), config.chainId()));
        return token;
    }

    /**
     * Derives a stable instance address when none is configured:
     * the last 20 bytes of {@code keccak256(deployer || chainId || keccak256(name))}.
     */
    static Address instanceAddress(final Address deployer, final TokenConfig config) {
        final byte[] hash = Keccak256.hash(
                deployer.toBytes(), Eip712.word(config.chainId()), Eip712.word(config.name()));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    // ═══════════════════════════════════════════════════════════════
    // Metadata
    // ═══════════════════════════════════════════════════════════════

    public String name() {
        return config.name();
    }

    public String version() {
        return config.version();
    }

    public String symbol() {
        return config.symbol();
    }

    public int decimals() {
        return config.decimals();
    }

    public BigInteger totalSupply() {
        return config.totalSupply();
    }

    /**
     * Returns the instance address bound into the signing domain.
     *
     * @return the token address
     */
    public Address address() {
        return address;
    }

    public Eip712Domain domain() {
        return engine.domain();
    }

    public Hash domainSeparator() {
        return engine.domainSeparator();
    }

    // ═══════════════════════════════════════════════════════════════
    // Balances
    // ═══════════════════════════════════════════════════════════════

    public BigInteger balanceOf(final Address account) {
        return engine.balanceOf(account);
    }

    /**
     * Moves {@code amount} from the caller's own balance.
     *
     * @param caller the sender
     * @param to     the recipient
     * @param amount the amount
     * @return the applied transfer
     */
    public TokenEvent.Transfer transfer(final Address caller, final Address to, final BigInteger amount) {
        return engine.transfer(caller, to, amount);
    }

    // ═══════════════════════════════════════════════════════════════
    // Authorizations
    // ═══════════════════════════════════════════════════════════════

    /**
     * @see AuthorizationEngine#transferWithAuthorization(TransferAuthorization, Signature)
     */
    public void transferWithAuthorization(final TransferAuthorization auth, final Signature signature) {
        engine.transferWithAuthorization(auth, signature);
    }

    /**
     * @see AuthorizationEngine#receiveWithAuthorization(Address, ReceiveAuthorization, Signature)
     */
    public void receiveWithAuthorization(
            final Address caller, final ReceiveAuthorization auth, final Signature signature) {
        engine.receiveWithAuthorization(caller, auth, signature);
    }

    /**
     * @see AuthorizationEngine#cancelAuthorization(CancelAuthorization, Signature)
     */
    public void cancelAuthorization(final CancelAuthorization auth, final Signature signature) {
        engine.cancelAuthorization(auth, signature);
    }

    public boolean authorizationState(final Address authorizer, final Nonce nonce) {
        return engine.authorizationState(authorizer, nonce);
    }

    public AuthorizationEngine engine() {
        return engine;
    }

    @Override
    public String toString() {
        return "Token[name=" + config.name() + ", symbol=" + config.symbol() + ", address=" + address.value() + "]";
    }
}
