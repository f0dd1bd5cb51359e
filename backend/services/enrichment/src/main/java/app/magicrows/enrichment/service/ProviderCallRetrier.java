package app.magicrows.enrichment.service;

import app.magicrows.enrichment.error.ProviderTransientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

public class ProviderCallRetrier {

    private static final Logger log = LoggerFactory.getLogger(ProviderCallRetrier.class);

    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public ProviderCallRetrier(int maxAttempts, long baseBackoffMs, long maxBackoffMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseBackoffMs = Math.max(0, baseBackoffMs);
        this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
        this.sleeper = sleeper;
    }

    public <T> T call(String description, Supplier<T> call) {
        int attempt = 1;
        while (true) {
            try {
                return call.get();
            } catch (ProviderTransientException ex) {
                if (attempt >= maxAttempts) {
                    log.warn("Provider call failed after attempts={} call={} status={} message={}",
                            attempt, description, ex.getStatusCode(), safeMessage(ex));
                    throw ex;
                }
                long backoff = computeBackoff(attempt);
                log.info("Transient provider failure, retrying attempt={} backoffMs={} call={} status={}",
                        attempt, backoff, description, ex.getStatusCode());
                pause(backoff, ex);
                attempt++;
            }
        }
    }

    long computeBackoff(int attempts) {
        long multiplier = 1L << Math.min(Math.max(attempts - 1, 0), 30);
        long backoff = baseBackoffMs * multiplier;
        if (backoff < 0) {
            return maxBackoffMs;
        }
        return Math.min(backoff, maxBackoffMs);
    }

    private void pause(long backoffMs, ProviderTransientException cause) {
        try {
            sleeper.sleep(backoffMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            ProviderTransientException interrupted = new ProviderTransientException(
                    "Interrupted while waiting to retry: " + cause.getMessage(), cause.getStatusCode(), cause);
            interrupted.addSuppressed(ex);
            throw interrupted;
        }
    }

    static String safeMessage(Exception ex) {
        if (ex == null) {
            return "";
        }
        String message = ex.getMessage();
        if (message == null) {
            return "";
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        int max = 200;
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }
}
