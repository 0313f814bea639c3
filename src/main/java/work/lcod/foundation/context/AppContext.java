package work.lcod.foundation.context;

/**
 * Central application context holding the typed configuration.
 *
 * <pre>{@code
 * AppContext<AppConfig> ctx = AppContext.builder()
 *     .withConfig(Config.builder().withFile(Path.of("app.toml"), true).build(AppConfig.class))
 *     .build();
 * }</pre>
 *
 * <p>The configuration is bound once, before the context exists, and never changes afterwards,
 * so a context can be shared between threads.
 */
public final class AppContext<C> {
    private final C config;

    private AppContext(C config) {
        this.config = config;
    }

    public C config() {
        return config;
    }

    public static Builder<Void> builder() {
        return new Builder<>(null);
    }

    @Override
    public String toString() {
        return "AppContext[config=" + config + "]";
    }

    /**
     * Starts without a configuration ({@code Builder<Void>}) and becomes a {@code Builder<C>}
     * once {@link #withConfig(Object)} is called.
     */
    public static final class Builder<C> {
        private final C config;

        private Builder(C config) {
            this.config = config;
        }

        public <T> Builder<T> withConfig(T config) {
            return new Builder<>(config);
        }

        /**
         * @throws MissingConfigException if no configuration was attached
         */
        public AppContext<C> build() {
            if (config == null) {
                throw new MissingConfigException();
            }
            return new AppContext<>(config);
        }
    }
}
