/**
 * Result of one attempt against one backend: either the client has been answered, or the
 * forwarder should try the next backend.
 *
 * @param responded true if a response was written to the client
 * @param failure   summary of why the attempt failed, null when responded
 */
public record AttemptOutcome(boolean responded, String failure) {

    private static final AttemptOutcome DELIVERED = new AttemptOutcome(true, null);

    public static AttemptOutcome delivered() {
        return DELIVERED;
    }

    public static AttemptOutcome retry(String failure) {
        return new AttemptOutcome(false, failure);
    }
}
