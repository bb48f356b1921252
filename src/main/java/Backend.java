/**
 * One configured upstream API endpoint. Immutable after load; the runtime enabled flag
 * lives in {@link BackendState}.
 *
 * @param name      log identifier
 * @param baseUrl   base URL, may carry a path prefix
 * @param token     bearer credential sent to this backend
 * @param enabled   enabled flag as loaded from configuration
 * @param model     optional model override, null when not configured
 * @param platform  wire protocol spoken by the backend
 */
public record Backend(String name, String baseUrl, String token, boolean enabled, String model, Platform platform) {

    /**
     * Wire protocol dialect of a backend.
     */
    public enum Platform {
        ANTHROPIC("anthropic"),
        OPENAI("openai");

        private final String tag;

        Platform(String tag) {
            this.tag = tag;
        }

        public String tag() {
            return tag;
        }

        /**
         * Resolves a configuration tag. A missing or blank tag means the native protocol.
         *
         * @throws IllegalArgumentException if the tag is not recognised
         */
        public static Platform fromTag(String tag) {
            if (tag == null || tag.isBlank()) {
                return ANTHROPIC;
            }
            for (Platform p : values()) {
                if (p.tag.equalsIgnoreCase(tag.trim())) {
                    return p;
                }
            }
            throw new IllegalArgumentException("Unknown platform '" + tag + "' (expected 'anthropic' or 'openai')");
        }
    }

    public boolean hasModelOverride() {
        return model != null && !model.isEmpty();
    }

    public boolean requiresConversion() {
        return platform == Platform.OPENAI;
    }
}
