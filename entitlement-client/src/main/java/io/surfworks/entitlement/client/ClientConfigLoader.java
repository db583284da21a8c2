package io.surfworks.entitlement.client;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Loads {@link ClientConfig}.
 *
 * <p>Configuration sources, first one present wins:
 * <ol>
 *   <li>Config file ({@code ~/.config/entitlement/config.json}) with keys
 *       {@code base_url}, {@code api_key}, {@code api_secret},
 *       {@code allow_insecure_http}, {@code log_level}</li>
 *   <li>Environment variables {@code ENTITLEMENT_BASE_URL},
 *       {@code ENTITLEMENT_API_KEY}, {@code ENTITLEMENT_API_SECRET},
 *       {@code ENTITLEMENT_ALLOW_INSECURE_HTTP}, {@code ENTITLEMENT_LOG_LEVEL}</li>
 * </ol>
 */
public final class ClientConfigLoader {

    private static final Logger LOG = Logger.getLogger(ClientConfigLoader.class.getName());

    public static final String ENV_BASE_URL = "ENTITLEMENT_BASE_URL";
    public static final String ENV_API_KEY = "ENTITLEMENT_API_KEY";
    public static final String ENV_API_SECRET = "ENTITLEMENT_API_SECRET";
    public static final String ENV_ALLOW_INSECURE_HTTP = "ENTITLEMENT_ALLOW_INSECURE_HTTP";
    public static final String ENV_LOG_LEVEL = "ENTITLEMENT_LOG_LEVEL";

    static final String KEY_BASE_URL = "base_url";
    static final String KEY_API_KEY = "api_key";
    static final String KEY_API_SECRET = "api_secret";
    static final String KEY_ALLOW_INSECURE_HTTP = "allow_insecure_http";
    static final String KEY_LOG_LEVEL = "log_level";

    private ClientConfigLoader() {
    }

    /**
     * Loads configuration from the default config file, or the environment
     * when the file does not exist.
     */
    public static ClientConfig load() throws ConfigException {
        return load(ClientConfig.configFile(), System::getenv);
    }

    /**
     * Loads configuration from a specific file, or the environment when the
     * file does not exist.
     */
    public static ClientConfig load(Path configFile) throws ConfigException {
        return load(configFile, System::getenv);
    }

    /**
     * Loads configuration from a specific file, falling back to the given
     * environment lookup.
     *
     * @param configFile path to the config file
     * @param env        environment variable lookup
     * @return the validated configuration
     * @throws ConfigException if the file is unreadable or a required value is missing
     */
    public static ClientConfig load(Path configFile, Function<String, String> env) throws ConfigException {
        ClientConfig config;
        if (configFile != null && Files.exists(configFile)) {
            config = loadFromFile(configFile);
        } else {
            LOG.info("No config file at " + configFile + "; reading from environment");
            config = loadFromEnv(env);
        }
        LicenseLogging.configure(config.logLevel());
        LOG.info("Resolved license config: base=" + config.baseUrl() + " verifyTls=" + config.verifyTls());
        return config;
    }

    private static ClientConfig loadFromFile(Path configFile) throws ConfigException {
        JsonObject root;
        try {
            String json = Files.readString(configFile, StandardCharsets.UTF_8);
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject()) {
                throw new ConfigException("Config file is not a JSON object: " + configFile);
            }
            root = parsed.getAsJsonObject();
        } catch (IOException e) {
            throw new ConfigException("Failed to read config file " + configFile + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new ConfigException("Failed to parse config file " + configFile + ": " + e.getMessage(), e);
        }

        boolean allowInsecure = parseFlag(stringOrNull(root, KEY_ALLOW_INSECURE_HTTP));
        return ClientConfig.of(
                stringOrNull(root, KEY_BASE_URL),
                stringOrNull(root, KEY_API_KEY),
                stringOrNull(root, KEY_API_SECRET),
                !allowInsecure
        ).withLogLevel(stringOrNull(root, KEY_LOG_LEVEL));
    }

    private static ClientConfig loadFromEnv(Function<String, String> env) throws ConfigException {
        boolean allowInsecure = parseFlag(env.apply(ENV_ALLOW_INSECURE_HTTP));
        return ClientConfig.of(
                env.apply(ENV_BASE_URL),
                env.apply(ENV_API_KEY),
                env.apply(ENV_API_SECRET),
                !allowInsecure
        ).withLogLevel(env.apply(ENV_LOG_LEVEL));
    }

    static boolean parseFlag(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim();
        return "1".equals(v) || "true".equalsIgnoreCase(v) || "yes".equalsIgnoreCase(v);
    }

    private static String stringOrNull(JsonObject node, String field) {
        if (!node.has(field) || node.get(field).isJsonNull()) {
            return null;
        }
        JsonElement value = node.get(field);
        if (value.isJsonPrimitive()) {
            return value.getAsString();
        }
        return value.toString();
    }
}
