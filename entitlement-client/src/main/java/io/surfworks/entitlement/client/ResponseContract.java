package io.surfworks.entitlement.client;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Interprets license service responses.
 *
 * <p>Two failure layers exist:
 * <ol>
 *   <li>HTTP status >= 400: {@link RequestException} with the message taken
 *       from {@code message}, else the first string inside any list field.</li>
 *   <li>HTTP success whose {@code data} object carries {@code errors} and/or
 *       {@code error_data}: {@link ContractException} with the first error
 *       code, its first message and its status.</li>
 * </ol>
 * Anything else is a success. A non-JSON body on success is a contract error.
 */
public final class ResponseContract {

    private static final Logger LOG = Logger.getLogger(ResponseContract.class.getName());

    private ResponseContract() {}

    /**
     * Classify a received response.
     *
     * @param status HTTP status code
     * @param body   response body (may be null)
     * @return the parsed success response
     * @throws RequestException  on HTTP error statuses
     * @throws ContractException on embedded errors or invalid JSON
     */
    public static LicenseResponse interpret(int status, String body) throws RequestException, ContractException {
        String text = body != null ? body : "";

        if (status >= 400) {
            JsonObject payload = errorPayload(text);
            String message = httpErrorMessage(payload);
            if (message == null) {
                message = "HTTP " + status;
            }
            LOG.severe("http_error: status=" + status + " message=" + message + " payload=" + LogFormat.compact(payload));
            throw new RequestException(message, status, payload);
        }

        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            LOG.severe("invalid_json: " + e.getMessage() + "; raw=" + LogFormat.compact(text));
            throw new ContractException("Invalid JSON response: " + e.getMessage(), status, raw(text), e);
        }
        // Lenient parsing accepts bare words, so anything but an object or array is rejected here.
        if (parsed == null || !(parsed.isJsonObject() || parsed.isJsonArray())) {
            LOG.severe("invalid_json: not an object or array; raw=" + LogFormat.compact(text));
            throw new ContractException("Invalid JSON response: expected an object or array", null, status, raw(text));
        }

        if (parsed.isJsonObject() && parsed.getAsJsonObject().has("data")) {
            JsonObject root = parsed.getAsJsonObject();
            JsonElement data = root.get("data");
            if (data.isJsonObject()
                    && (data.getAsJsonObject().has("errors") || data.getAsJsonObject().has("error_data"))) {
                throw embeddedError(root, data.getAsJsonObject());
            }
        } else {
            LOG.fine("interpret: non-wrapper body=" + LogFormat.compact(parsed));
        }
        return LicenseResponse.from(parsed);
    }

    private static ContractException embeddedError(JsonObject root, JsonObject data) {
        JsonElement errorsElement = data.get("errors");
        JsonElement errorDataElement = data.get("error_data");
        JsonObject errors = errorsElement != null && errorsElement.isJsonObject()
            ? errorsElement.getAsJsonObject() : new JsonObject();
        JsonObject errorData = errorDataElement != null && errorDataElement.isJsonObject()
            ? errorDataElement.getAsJsonObject() : new JsonObject();

        String code = errors.keySet().isEmpty() ? ContractException.DEFAULT_CODE : errors.keySet().iterator().next();

        String message = null;
        JsonElement messages = errors.get(code);
        if (messages != null && messages.isJsonArray() && messages.getAsJsonArray().size() > 0) {
            JsonElement first = messages.getAsJsonArray().get(0);
            message = first.isJsonPrimitive() ? first.getAsString() : first.toString();
        }
        if (message == null || message.isEmpty()) {
            message = "Operation failed";
        }

        Integer embeddedStatus = null;
        JsonElement entry = errorData.get(code);
        if (entry != null && entry.isJsonObject() && entry.getAsJsonObject().has("status")) {
            try {
                embeddedStatus = entry.getAsJsonObject().get("status").getAsInt();
            } catch (RuntimeException e) {
                embeddedStatus = null;
            }
        }

        LOG.severe("contract_error: code=" + code + " status=" + embeddedStatus
            + " msg=" + message + " body=" + LogFormat.compact(root));
        return new ContractException(message, code, embeddedStatus, root);
    }

    private static JsonObject errorPayload(String text) {
        try {
            JsonElement parsed = JsonParser.parseString(text);
            if (parsed != null && parsed.isJsonObject()) {
                return parsed.getAsJsonObject();
            }
        } catch (JsonParseException e) {
            LOG.fine("error body is not JSON: " + e.getMessage());
        }
        return raw(text);
    }

    static String httpErrorMessage(JsonObject payload) {
        JsonElement message = payload.get("message");
        if (message != null && message.isJsonPrimitive() && !message.getAsString().isEmpty()) {
            return message.getAsString();
        }
        for (Map.Entry<String, JsonElement> entry : payload.entrySet()) {
            if (!entry.getValue().isJsonArray()) {
                continue;
            }
            JsonArray values = entry.getValue().getAsJsonArray();
            for (JsonElement value : values) {
                if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
                    return value.getAsString();
                }
            }
        }
        return null;
    }

    private static JsonObject raw(String text) {
        JsonObject raw = new JsonObject();
        raw.addProperty("raw", text);
        return raw;
    }
}
