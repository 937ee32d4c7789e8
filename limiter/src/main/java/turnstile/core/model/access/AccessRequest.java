package turnstile.core.model.access;

/**
 * Input to an access evaluation.
 *
 * @param identity client identity, usually the source address
 * @param consumer the consuming service or worker name
 * @param country ISO country code of the client, or null when unknown
 */
public record AccessRequest(String identity, String consumer, String country) {

    public static final String UNKNOWN_IDENTITY = "unknown";
    public static final String UNKNOWN_CONSUMER = "unknown-consumer";

    public static AccessRequest of(String identity, String consumer) {
        return new AccessRequest(identity, consumer, null);
    }

    /**
     * Returns a copy with blank identity and consumer replaced by placeholders
     * and the country upper-cased.
     */
    public AccessRequest normalized() {
        final var id = identity == null || identity.isBlank() ? UNKNOWN_IDENTITY : identity.trim();
        final var name = consumer == null || consumer.isBlank() ? UNKNOWN_CONSUMER : consumer.trim();
        final var cc = country == null || country.isBlank() ? null : country.trim().toUpperCase();
        return new AccessRequest(id, name, cc);
    }

    public boolean hasCountry() {
        return country != null && !country.isBlank();
    }
}
