package com.hashicorp.vault.broker.auth;

import com.hashicorp.vault.broker.AuthenticationException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches the token produced by a {@link VaultAuthenticator} and refreshes it on demand.
 *
 * <p>{@link #getAuthToken()} returns the cached token while it is outside the safety
 * margin of its expiry. Otherwise it starts a login through the authenticator. Callers
 * arriving while that login is in flight share its outcome, so at most one login runs
 * at a time for a manager.
 *
 * <p>There is no background renewal. A failed login is never cached: every waiting
 * caller gets an {@link AuthenticationException} and the next call tries again.
 *
 * <h2>States</h2>
 * <pre>
 * UNAUTHENTICATED --getAuthToken--&gt; AUTHENTICATING --ok--&gt; AUTHENTICATED
 *        ^                                 |                      |
 *        +------------- failure -----------+       near expiry ---+--&gt; AUTHENTICATING
 * </pre>
 */
public class VaultTokenManager {

    private static final Logger logger = LoggerFactory.getLogger(VaultTokenManager.class);

    /** Default time before expiry at which a token is replaced. */
    public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofSeconds(30);

    /**
     * Lifecycle state of a manager.
     */
    public enum State {
        UNAUTHENTICATED,
        AUTHENTICATING,
        AUTHENTICATED
    }

    private final VaultAuthenticator authenticator;
    private final Clock clock;
    private final Duration safetyMargin;

    private final Object lock = new Object();
    // Guarded by lock
    private VaultToken token;
    private CompletableFuture<VaultToken> inFlight;

    public VaultTokenManager(VaultAuthenticator authenticator) {
        this(authenticator, Clock.systemUTC(), DEFAULT_SAFETY_MARGIN);
    }

    /**
     * @param authenticator the login strategy, owned by this manager
     * @param clock         time source for expiry checks; must match the authenticator's
     * @param safetyMargin  time before expiry at which a token is refreshed
     */
    public VaultTokenManager(VaultAuthenticator authenticator, Clock clock, Duration safetyMargin) {
        if (authenticator == null) {
            throw new IllegalArgumentException("Authenticator cannot be null");
        }
        if (safetyMargin == null || safetyMargin.isNegative()) {
            throw new IllegalArgumentException("Safety margin must be zero or positive: " + safetyMargin);
        }
        this.authenticator = authenticator;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.safetyMargin = safetyMargin;
    }

    /**
     * Returns a usable token, logging in first if needed.
     *
     * <p>Each caller gets its own dependent future; cancelling it does not affect the
     * shared login.
     *
     * @return a future completed with a token outside its safety margin, or exceptionally
     *         with an {@link AuthenticationException}
     */
    public CompletableFuture<VaultToken> getAuthToken() {
        CompletableFuture<VaultToken> refresh;
        synchronized (lock) {
            if (token != null && !token.isExpiring(clock.instant(), safetyMargin)) {
                logger.trace("Using cached {} token", authenticator.getAuthMethod());
                return CompletableFuture.completedFuture(token);
            }
            if (inFlight != null) {
                logger.debug("Waiting for in-flight {} authentication", authenticator.getAuthMethod());
                return inFlight.copy();
            }
            if (token != null) {
                logger.info("Vault token expires at {}, re-authenticating using {}",
                        token.getExpiresAt(), authenticator.getAuthMethod());
            } else {
                logger.info("Authenticating to Vault using {}", authenticator.getAuthMethod());
            }
            refresh = new CompletableFuture<>();
            inFlight = refresh;
        }

        startRefresh(refresh);
        return refresh.copy();
    }

    private void startRefresh(CompletableFuture<VaultToken> refresh) {
        CompletableFuture<VaultToken> attempt;
        try {
            attempt = authenticator.authenticate();
            if (attempt == null) {
                throw new IllegalStateException(authenticator.getClass().getName()
                        + ".authenticate() returned null");
            }
        } catch (RuntimeException e) {
            attempt = CompletableFuture.failedFuture(e);
        }

        attempt.whenComplete((newToken, error) -> {
            if (error != null) {
                fail(refresh, unwrap(error));
            } else if (newToken == null) {
                fail(refresh, new IllegalStateException("Authenticator completed without a token"));
            } else {
                succeed(refresh, newToken);
            }
        });
    }

    private void succeed(CompletableFuture<VaultToken> refresh, VaultToken newToken) {
        synchronized (lock) {
            token = newToken;
            inFlight = null;
        }
        if (newToken.isNonExpiring()) {
            logger.info("{} authentication successful, token does not expire",
                    authenticator.getAuthMethod());
        } else {
            logger.info("{} authentication successful, token valid for {}s (renewable: {})",
                    authenticator.getAuthMethod(), newToken.getLeaseDuration().getSeconds(),
                    newToken.isRenewable());
        }
        refresh.complete(newToken);
    }

    private void fail(CompletableFuture<VaultToken> refresh, Throwable cause) {
        synchronized (lock) {
            token = null;
            inFlight = null;
        }
        AuthenticationException failure = cause instanceof AuthenticationException
                ? (AuthenticationException) cause
                : new AuthenticationException(authenticator.getAuthMethod()
                        + " authentication failed: " + cause.getMessage(), cause);
        logger.warn("Vault authentication failed: {}", failure.getMessage());
        logger.debug("Authentication failure", cause);
        refresh.completeExceptionally(failure);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Drops the cached token so the next {@link #getAuthToken()} logs in again.
     *
     * <p>A login already in flight is unaffected and its token is cached when it
     * completes.
     */
    public void invalidate() {
        synchronized (lock) {
            if (token != null) {
                logger.info("Discarding cached {} token", authenticator.getAuthMethod());
            }
            token = null;
        }
    }

    /**
     * Returns the current lifecycle state.
     */
    public State getState() {
        synchronized (lock) {
            if (inFlight != null) {
                return State.AUTHENTICATING;
            }
            return token != null ? State.AUTHENTICATED : State.UNAUTHENTICATED;
        }
    }

    public AuthMethod getAuthMethod() {
        return authenticator.getAuthMethod();
    }

    public Duration getSafetyMargin() {
        return safetyMargin;
    }
}
