package com.neolms.studygroups.util;

import com.neolms.studygroups.exception.RepositoryException;
import com.neolms.studygroups.exception.TransactionFailedException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.function.Supplier;

/**
 * Times DynamoDB calls, logs slow ones and records a {@code dynamodb.query.duration}
 * timer tagged with operation, table and outcome.
 */
@Component
public class QueryPerformanceTracker {

    private static final Logger logger = LoggerFactory.getLogger(QueryPerformanceTracker.class);
    private static final long SLOW_QUERY_THRESHOLD_MS = 500L;

    private final MeterRegistry meterRegistry;

    @Autowired
    public QueryPerformanceTracker(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Run a repository call under the timer.
     *
     * Conditional-write rejections surface as domain exceptions from the supplier and are
     * recorded with outcome {@code rejected}; only DynamoDB errors count as failures.
     *
     * @param operation DynamoDB API name, e.g. TransactWriteItems
     * @param table table the call targets
     */
    public <T> T trackQuery(String operation, String table, Supplier<T> queryOperation) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        String outcome = "success";

        try {
            T result = queryOperation.get();
            long duration = System.currentTimeMillis() - startTime;

            if (duration > SLOW_QUERY_THRESHOLD_MS) {
                logger.warn("Slow DynamoDB call: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            } else {
                logger.debug("DynamoDB call completed: operation={}, table={}, duration={}ms",
                    operation, table, duration);
            }
            return result;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            if (isStoreFailure(e)) {
                outcome = "error";
                logger.error("DynamoDB call failed: operation={}, table={}, duration={}ms, error={}",
                    operation, table, duration, e.getMessage());
            } else {
                outcome = "rejected";
                logger.debug("DynamoDB call rejected: operation={}, table={}, duration={}ms, reason={}",
                    operation, table, duration, e.getClass().getSimpleName());
            }
            throw e;

        } finally {
            sample.stop(Timer.builder("dynamodb.query.duration")
                .tag("operation", operation)
                .tag("table", table)
                .tag("outcome", outcome)
                .register(meterRegistry));
        }
    }

    private static boolean isStoreFailure(RuntimeException e) {
        return e instanceof DynamoDbException
            || e instanceof RepositoryException
            || e instanceof TransactionFailedException;
    }
}
