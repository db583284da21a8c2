package io.surfworks.entitlement.client;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * A successful license service response.
 *
 * <p>Only the fields the lifecycle logic relies on are lifted out
 * ({@code expiresAt}, {@code activationData}, {@code timesActivated}); the
 * rest of the body stays available through {@link #body()}.
 */
public final class LicenseResponse {

    private final JsonElement body;
    private final JsonElement data;
    private final String expiresAt;
    private final List<ActivationRecord> activations;
    private final boolean singleActivation;
    private final int timesActivated;

    private LicenseResponse(JsonElement body, JsonElement data, String expiresAt,
                            List<ActivationRecord> activations, boolean singleActivation, int timesActivated) {
        this.body = body;
        this.data = data;
        this.expiresAt = expiresAt;
        this.activations = List.copyOf(activations);
        this.singleActivation = singleActivation;
        this.timesActivated = timesActivated;
    }

    /**
     * Lift the known fields out of a parsed body.
     */
    public static LicenseResponse from(JsonElement body) {
        JsonElement data = body;
        if (body != null && body.isJsonObject() && body.getAsJsonObject().has("data")) {
            JsonElement inner = body.getAsJsonObject().get("data");
            if (inner.isJsonObject() || inner.isJsonArray()) {
                data = inner;
            }
        }

        String expiresAt = null;
        List<ActivationRecord> activations = new ArrayList<>();
        boolean single = false;
        int timesActivated = 0;

        if (data != null && data.isJsonObject()) {
            JsonObject obj = data.getAsJsonObject();
            expiresAt = string(obj, "expiresAt");
            if (expiresAt != null && expiresAt.isBlank()) {
                expiresAt = null;
            }

            JsonElement activationData = obj.get("activationData");
            if (activationData != null && activationData.isJsonObject()) {
                activations.add(toRecord(activationData.getAsJsonObject()));
                single = true;
            } else if (activationData != null && activationData.isJsonArray()) {
                JsonArray array = activationData.getAsJsonArray();
                for (JsonElement element : array) {
                    if (element.isJsonObject()) {
                        activations.add(toRecord(element.getAsJsonObject()));
                    }
                }
            }
            timesActivated = integer(obj, "timesActivated");
        }

        return new LicenseResponse(body, data, expiresAt, activations, single, timesActivated);
    }

    /**
     * The whole response body.
     */
    public JsonElement body() {
        return body;
    }

    /**
     * The {@code data} element, or the whole body when there is none.
     */
    public JsonElement data() {
        return data;
    }

    /**
     * Raw {@code expiresAt} value, or null.
     */
    public String expiresAt() {
        return expiresAt;
    }

    public List<ActivationRecord> activations() {
        return activations;
    }

    /**
     * True when {@code activationData} was a single object rather than a list.
     */
    public boolean singleActivation() {
        return singleActivation;
    }

    public int timesActivated() {
        return timesActivated;
    }

    /**
     * Whether any activation is still live, or the service counts at least one.
     */
    public boolean hasActiveActivation() {
        for (ActivationRecord record : activations) {
            if (record.isActive()) {
                return true;
            }
        }
        return timesActivated > 0;
    }

    @Override
    public String toString() {
        return LogFormat.compact(body);
    }

    private static ActivationRecord toRecord(JsonObject obj) {
        String token = string(obj, "token");
        return new ActivationRecord(
            token != null ? token.trim() : null,
            string(obj, "created_at"),
            string(obj, "updated_at"),
            string(obj, "deactivated_at")
        );
    }

    static String string(JsonObject obj, String field) {
        if (obj == null || !obj.has(field)) {
            return null;
        }
        JsonElement value = obj.get(field);
        if (value.isJsonNull()) {
            return null;
        }
        if (value.isJsonPrimitive()) {
            return value.getAsString();
        }
        return value.toString();
    }

    private static int integer(JsonObject obj, String field) {
        String value = string(obj, field);
        if (value == null || value.isBlank()) {
            return 0;
        }
        try {
            return (int) Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
