package turnstile.core.port.in;

import java.time.Instant;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.access.AccessRequest;
import turnstile.core.model.access.Decision;

/**
 * Port for deciding whether a client request may proceed.
 *
 * <p>Evaluation only reads window counters. Usage is recorded separately
 * through {@link #commit} once the downstream work has succeeded, so failed
 * work does not consume quota.
 *
 * <p>Evaluation never fails because storage is unavailable; every call
 * completes with a {@link Decision}.
 */
public interface AccessEvaluation {

    /**
     * Evaluates a request at a given instant.
     *
     * @param identity client identity, usually the source address
     * @param consumer the consuming service
     * @param now evaluation time
     * @return Uni with the decision
     */
    Uni<Decision> evaluate(String identity, String consumer, Instant now);

    /**
     * Evaluates a request at the current time.
     *
     * @param identity client identity
     * @param consumer the consuming service
     * @return Uni with the decision
     */
    Uni<Decision> evaluate(String identity, String consumer);

    /**
     * Evaluates a request that may carry a country code, at the current time.
     *
     * @param request the request
     * @return Uni with the decision
     */
    Uni<Decision> evaluate(AccessRequest request);

    /**
     * Records one unit of usage in every enforced window.
     *
     * <p>Not idempotent: each call consumes quota. Never fails.
     *
     * @param identity client identity
     * @param consumer the consuming service
     * @return Uni completing once usage is recorded
     */
    Uni<Void> commit(String identity, String consumer);
}
