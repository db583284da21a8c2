package io.surfworks.entitlement.lifecycle;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores the license record as JSON in {@code <configDir>/license-state.json}.
 */
public class FileLicenseStateStore implements LicenseStateStore {

    private static final Logger LOG = Logger.getLogger(FileLicenseStateStore.class.getName());

    private static final String STATE_FILE = "license-state.json";
    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .disableHtmlEscaping()
        .create();

    private final Path configDir;
    private final Path stateFile;

    public FileLicenseStateStore(Path configDir) {
        this.configDir = configDir;
        this.stateFile = configDir.resolve(STATE_FILE);
    }

    public Path stateFile() {
        return stateFile;
    }

    @Override
    public LicenseState load() {
        if (!Files.exists(stateFile)) {
            return new LicenseState();
        }

        try {
            String json = Files.readString(stateFile, StandardCharsets.UTF_8);
            StoredState stored = GSON.fromJson(json, StoredState.class);
            if (stored == null) {
                return new LicenseState();
            }

            LicenseState state = new LicenseState(stored.licenseKey);
            state.setStatus(LicenseStatus.fromName(stored.status));
            state.setActivationToken(stored.activationToken);
            state.setExpiresAt(instant(stored.expiresAt));
            state.setGraceUntil(instant(stored.graceUntil));
            state.setReason(stored.reason);
            state.setLastValidated(instant(stored.lastValidated));
            state.setLastResponseRaw(stored.lastResponseRaw);
            state.setLastErrorRaw(stored.lastErrorRaw);
            return state;
        } catch (IOException | JsonParseException | DateTimeParseException e) {
            LOG.log(Level.WARNING, "Unreadable license state at " + stateFile + "; starting fresh", e);
            return new LicenseState();
        }
    }

    @Override
    public void save(LicenseState state) throws IOException {
        StoredState stored = new StoredState();
        stored.licenseKey = state.getLicenseKey();
        stored.status = state.getStatus().name();
        stored.activationToken = state.getActivationToken();
        stored.expiresAt = text(state.getExpiresAt());
        stored.graceUntil = text(state.getGraceUntil());
        stored.reason = state.getReason();
        stored.lastValidated = text(state.getLastValidated());
        stored.lastResponseRaw = state.getLastResponseRaw();
        stored.lastErrorRaw = state.getLastErrorRaw();

        Files.createDirectories(configDir);
        Path tmp = configDir.resolve(STATE_FILE + ".tmp");
        Files.writeString(tmp, GSON.toJson(stored), StandardCharsets.UTF_8);
        try {
            Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Instant instant(String value) {
        return value != null && !value.isBlank() ? Instant.parse(value) : null;
    }

    private static String text(Instant value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Internal structure for JSON serialization.
     */
    private static class StoredState {
        String licenseKey;
        String status;
        String activationToken;
        String expiresAt;
        String graceUntil;
        String reason;
        String lastValidated;
        String lastResponseRaw;
        String lastErrorRaw;
    }
}
