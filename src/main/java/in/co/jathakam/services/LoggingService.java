package in.co.jathakam.services;

import com.amazonaws.services.lambda.runtime.Context;
import com.google.gson.Gson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging for chart requests.
 *
 * Messages are snake_case event names ({@code chart_computation_completed}); request-scoped
 * values live in the log4j2 ThreadContext and are printed by the layout in log4j2.xml.
 *
 * <pre>
 * -- Find slow chart computations
 * fields @timestamp, message, data
 * | filter message = "chart_computation_completed"
 * | sort @timestamp desc
 * </pre>
 */
public class LoggingService {

    private static final Logger logger = LogManager.getLogger(LoggingService.class);
    private static final Gson gson = new Gson();

    // ThreadContext keys
    public static final String KEY_REQUEST_ID = "requestId";
    public static final String KEY_FUNCTION = "function";
    public static final String KEY_PLACE = "place";
    public static final String KEY_DATA = "data";

    /**
     * Reset the context and tag it with the Lambda request id.
     * Call at the start of every invocation.
     */
    public static void initRequest(Context context) {
        clearContext();
        if (context != null && context.getAwsRequestId() != null) {
            ThreadContext.put(KEY_REQUEST_ID, context.getAwsRequestId());
        }
    }

    public static void setFunction(String function) {
        if (function != null) {
            ThreadContext.put(KEY_FUNCTION, function);
        }
    }

    public static void setPlace(String place) {
        if (place != null) {
            ThreadContext.put(KEY_PLACE, place);
        }
    }

    public static void clearContext() {
        ThreadContext.clearAll();
    }

    // =========================================================================
    // Logging Methods
    // =========================================================================

    public static void debug(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.debug(message);
        clearDataContext();
    }

    public static void info(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.info(message);
        clearDataContext();
    }

    public static void warn(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.warn(message);
        clearDataContext();
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
    }

    // =========================================================================
    // Operation timing
    // =========================================================================

    /**
     * Log {@code <operation>_started} and return the start time for {@link #logOperationEnd}.
     */
    public static long logOperationStart(String operation, Map<String, Object> data) {
        info(operation + "_started", data);
        return System.currentTimeMillis();
    }

    public static void logOperationEnd(String operation, long startTime, Map<String, Object> additionalData) {
        Map<String, Object> data = new HashMap<>(additionalData);
        data.put("durationMs", System.currentTimeMillis() - startTime);
        info(operation + "_completed", data);
    }

    /**
     * Expected failures (bad input, unknown place) are logged at WARN without a stack trace.
     */
    public static void logOperationFailed(String operation, long startTime, String errorCode, String errorMessage) {
        Map<String, Object> data = new HashMap<>();
        data.put("durationMs", System.currentTimeMillis() - startTime);
        data.put("errorCode", errorCode);
        data.put("errorMessage", errorMessage);
        warn(operation + "_failed", data);
    }

    // =========================================================================
    // Helper Methods
    // =========================================================================

    private static void setDataContext(Map<String, Object> data) {
        if (data != null && !data.isEmpty()) {
            ThreadContext.put(KEY_DATA, gson.toJson(data));
        }
    }

    private static void clearDataContext() {
        ThreadContext.remove(KEY_DATA);
    }

    /**
     * Build a mutable map from alternating keys and values.
     */
    public static Map<String, Object> data(Object... keyValuePairs) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length - 1; i += 2) {
            map.put(String.valueOf(keyValuePairs[i]), keyValuePairs[i + 1]);
        }
        return map;
    }
}
