package in.co.jathakam.rest;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import in.co.jathakam.pojos.ErrorKind;

/**
 * Turns the {@code success:true/false} JSON that handlers return into an {@link ApiResponse}
 * with a matching HTTP status code.
 */
public class ResponseConverter {

    public static ApiResponse fromHandlerResponse(String handlerResult) {
        if (handlerResult == null) {
            return ApiResponse.errorMessage("No response from handler");
        }

        JsonObject json;
        try {
            JsonElement element = JsonParser.parseString(handlerResult);
            if (!element.isJsonObject()) {
                return ApiResponse.ok(handlerResult);
            }
            json = element.getAsJsonObject();
        } catch (JsonParseException e) {
            return ApiResponse.errorMessage("Handler returned malformed JSON");
        }

        // No success field is treated as success
        if (!json.has("success") || json.get("success").getAsBoolean()) {
            return ApiResponse.ok(handlerResult);
        }
        return determineErrorStatus(json, handlerResult);
    }

    /**
     * INVALID_INPUT and NUMERIC_DOMAIN_ERROR are 422, LOCATION_UNRESOLVED is 404; anything else is 400.
     */
    static ApiResponse determineErrorStatus(JsonObject json, String rawJson) {
        ErrorKind kind = json.has("errorCode") ? ErrorKind.fromString(json.get("errorCode").getAsString()) : null;
        if (kind == null) {
            return ApiResponse.badRequest(rawJson);
        }
        switch (kind) {
            case LOCATION_UNRESOLVED:
                return ApiResponse.notFound(rawJson);
            case INVALID_INPUT:
            case NUMERIC_DOMAIN_ERROR:
                return ApiResponse.unprocessable(rawJson);
            default:
                return ApiResponse.badRequest(rawJson);
        }
    }
}
