import java.io.IOException;

import com.sun.net.httpserver.HttpExchange;

/**
 * Failover proxy for Messages API clients.
 * Forwards every request to the highest-priority healthy backend, translating to and from
 * Chat Completions for backends that speak that protocol. Management endpoints share the
 * proxy port.
 */
public class FailoverProxy extends HttpProxy {

    private final ManagementApi managementApi;

    public FailoverProxy(ConfigurationManager configManager, CircuitBreaker circuitBreaker, int port) {
        super(
            port,
            Constants.CONNECTION_TIMEOUT,
            configManager.getRuntimeConfig().requestTimeout,
            circuitBreaker,
            new BackendRouter()
        );
        this.managementApi = new ManagementApi(configManager, circuitBreaker);
    }

    public static void main(String[] args) throws Exception {
        String configPath;
        try {
            configPath = parseConfigPath(args);
        } catch (IllegalArgumentException e) {
            Logger.error(e.getMessage());
            Logger.error("Usage: java -jar llm-failover-proxy.jar [--config <path>]");
            System.exit(1);
            return;
        }

        ConfigurationManager configManager = ConfigurationManager.load(configPath);
        if (configManager == null) {
            Logger.error("Failed to initialize configuration");
            System.exit(1);
            return;
        }

        RuntimeConfig runtime = configManager.getRuntimeConfig();
        CircuitBreaker circuitBreaker = new CircuitBreaker(runtime);
        FailoverProxy proxy = new FailoverProxy(configManager, circuitBreaker, runtime.port);
        proxy.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Logger.info("Shutting down, waiting up to " + Constants.SHUTDOWN_GRACE_SECONDS + "s for in-flight requests");
            try {
                proxy.stop();
            } catch (IOException e) {
                Logger.error("Failed to stop server", e);
            }
        }, "shutdown-hook"));

        logStartupSummary(configPath, runtime, proxy.getPort());
    }

    /**
     * Reads {@code --config <path>} (or {@code -config <path>}) from the command line.
     *
     * @return the configured path, or the default {@code config.toml}
     * @throws IllegalArgumentException if the flag has no value or an argument is unknown
     */
    static String parseConfigPath(String[] args) {
        String configPath = Constants.CONFIG_FILE;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--config") || arg.equals("-config")) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Missing value for " + arg);
                }
                configPath = args[++i];
            } else if (arg.startsWith("--config=") || arg.startsWith("-config=")) {
                configPath = arg.substring(arg.indexOf('=') + 1);
            } else {
                throw new IllegalArgumentException("Unknown argument: " + arg);
            }
        }
        return configPath;
    }

    private static void logStartupSummary(String configPath, RuntimeConfig runtime, int port) {
        RuntimeConfig.CircuitBreakerSettings cb = runtime.circuitBreaker;
        Logger.info("Proxy server running on port " + port + " (config: " + configPath + ")");
        Logger.info("Non-streaming request timeout: " + runtime.requestTimeout.toSeconds() + "s, streaming requests: no timeout");
        Logger.info("Circuit breaker: failure_threshold=" + cb.failureThreshold
            + " open_timeout=" + cb.openTimeout.toSeconds() + "s"
            + " half_open_requests=" + cb.halfOpenRequests
            + " rate_limit_cooldown=" + cb.rateLimitCooldown.toSeconds() + "s");
        int priority = 1;
        for (Backend backend : runtime.backends) {
            Logger.info("  " + priority++ + ". " + backend.name() + " - " + backend.baseUrl()
                + " [" + backend.platform().tag() + "]"
                + (backend.hasModelOverride() ? " model=" + backend.model() : "")
                + (backend.enabled() ? "" : " (disabled)")
                + " token=" + Logger.maskToken(backend.token()));
        }
        Logger.info("Management API: /health, /backends, /backends/status, /backend/{name}/enable, /backend/{name}/disable");
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            if (managementApi.handle(exchange)) {
                exchange.close();
                return;
            }
        } catch (Exception e) {
            Logger.error("[management] unhandled error on " + exchange.getRequestURI().getPath(), e);
            if (exchange.getResponseCode() == -1) {
                HttpServerWrapper.sendError(exchange, 500, "api_error", "Internal Server Error");
            }
            exchange.close();
            return;
        }

        super.handle(exchange);
    }
}
