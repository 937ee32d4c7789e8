package turnstile.core.model.access;

import java.time.Instant;

import turnstile.core.model.ratelimit.WindowKind;

/**
 * One rate limit violation, as kept in an identity's recent history.
 *
 * @param identity the violating identity
 * @param consumer the consumer the request was for
 * @param window the window whose limit was reached
 * @param at when the violation happened
 */
public record ViolationRecord(String identity, String consumer, WindowKind window, Instant at) {}
