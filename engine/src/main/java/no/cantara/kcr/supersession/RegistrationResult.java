package no.cantara.kcr.supersession;

/**
 * Outcome of registering a supersession.
 *
 * @param success    false when nothing was stored
 * @param warning    data-quality note, present on failure and on dangling targets
 * @param chainDepth supersession hops behind the registering document after the call
 */
public record RegistrationResult(boolean success, String warning, int chainDepth) {

    static RegistrationResult stored(int chainDepth, String warning) {
        return new RegistrationResult(true, warning, chainDepth);
    }

    static RegistrationResult rejected(String warning) {
        return new RegistrationResult(false, warning, 0);
    }
}
