package in.co.pricematch.services;

import com.google.gson.Gson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Structured logging for matching runs.
 *
 * Features:
 * - Run ID tracking so every line of one batch can be grouped
 * - Pair context (primaryId, candidateId) while a pair is being scored
 * - Arbitrary key/value payloads serialized to the {@code data} context entry as JSON
 *
 * <pre>
 * -- All failures of one run
 * runId = "..." AND message = "pair_scoring_failed"
 * </pre>
 */
public class LoggingService {

    private static final Logger logger = LogManager.getLogger(LoggingService.class);
    private static final Gson gson = new Gson();

    // ThreadContext (MDC) keys
    public static final String KEY_RUN_ID = "runId";
    public static final String KEY_FUNCTION = "function";
    public static final String KEY_PRIMARY_ID = "primaryId";
    public static final String KEY_CANDIDATE_ID = "candidateId";
    public static final String KEY_DATA = "data";

    /**
     * Start a new run and return its generated id.
     */
    public static String initRun() {
        String runId = UUID.randomUUID().toString();
        initRun(runId);
        return runId;
    }

    /**
     * Initialize logging context with a caller-supplied run ID.
     * Worker threads call this with the parent's run ID.
     */
    public static void initRun(String runId) {
        clearContext();
        if (runId != null) {
            ThreadContext.put(KEY_RUN_ID, runId);
        }
    }

    public static String currentRunId() {
        return ThreadContext.get(KEY_RUN_ID);
    }

    /**
     * Set the current function being executed.
     *
     * @param function Function name (e.g., "batch_match")
     */
    public static void setFunction(String function) {
        if (function != null) {
            ThreadContext.put(KEY_FUNCTION, function);
        }
    }

    /**
     * Set the pair under evaluation.
     */
    public static void setPair(long primaryId, long candidateId) {
        ThreadContext.put(KEY_PRIMARY_ID, String.valueOf(primaryId));
        ThreadContext.put(KEY_CANDIDATE_ID, String.valueOf(candidateId));
    }

    public static void clearPair() {
        ThreadContext.remove(KEY_PRIMARY_ID);
        ThreadContext.remove(KEY_CANDIDATE_ID);
    }

    /**
     * Clear all logging context. Call at the end of a run.
     */
    public static void clearContext() {
        ThreadContext.clearAll();
    }

    // =========================================================================
    // Logging Methods
    // =========================================================================

    public static void debug(String message) {
        logger.debug(message);
    }

    public static void debug(String message, Map<String, Object> data) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        setDataContext(data);
        logger.debug(message);
        clearDataContext();
    }

    public static void info(String message) {
        logger.info(message);
    }

    public static void info(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.info(message);
        clearDataContext();
    }

    public static void warn(String message) {
        logger.warn(message);
    }

    public static void warn(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.warn(message);
        clearDataContext();
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
    }

    public static void error(String message, Throwable t, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message, t);
        clearDataContext();
    }

    // =========================================================================
    // Convenience Methods for Common Patterns
    // =========================================================================

    /**
     * Log the start of an operation. Returns start time for use with logOperationEnd.
     */
    public static long logOperationStart(String operation, Map<String, Object> data) {
        info(operation + "_started", data);
        return System.currentTimeMillis();
    }

    public static void logOperationEnd(String operation, long startTime, Map<String, Object> additionalData) {
        long duration = System.currentTimeMillis() - startTime;
        Map<String, Object> data = new HashMap<>(additionalData);
        data.put("durationMs", duration);
        info(operation + "_completed", data);
    }

    public static void logOperationFailed(String operation, long startTime, Throwable t) {
        long duration = System.currentTimeMillis() - startTime;
        error(operation + "_failed", t, Map.of("durationMs", duration));
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
     * Create a mutable map with the given key-value pairs.
     */
    public static Map<String, Object> data(Object... keyValuePairs) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length - 1; i += 2) {
            map.put(String.valueOf(keyValuePairs[i]), keyValuePairs[i + 1]);
        }
        return map;
    }
}
