package com.tenacy.logradar.support;

import com.tenacy.logradar.exception.TransientIOException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 일시적 I/O 실패를 지수 백오프로 재시도한다. 재시도 횟수를 넘기면 마지막 예외를 던진다.
 */
@Slf4j
public class BoundedRetry {

    private final String operation;
    private final int maxRetries;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public BoundedRetry(String operation, int maxRetries, Duration initialBackoff, Duration maxBackoff) {
        this.operation = operation;
        this.maxRetries = Math.max(0, maxRetries);
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    /**
     * @throws TransientIOException 모든 시도가 실패했거나 대기 중 인터럽트되었을 때
     */
    public <T> T execute(Supplier<T> action) {
        Duration backoff = initialBackoff;
        int attempt = 0;

        while (true) {
            try {
                return action.get();
            } catch (TransientIOException e) {
                if (attempt >= maxRetries) {
                    throw e;
                }
                attempt++;
                log.warn("{} 실패, {}ms 후 재시도 ({}/{}): {}",
                        operation, backoff.toMillis(), attempt, maxRetries, e.getMessage());
                pause(backoff, e);
                backoff = next(backoff);
            }
        }
    }

    public void run(Runnable action) {
        execute(() -> {
            action.run();
            return null;
        });
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private Duration next(Duration backoff) {
        Duration doubled = backoff.multipliedBy(2);
        return doubled.compareTo(maxBackoff) > 0 ? maxBackoff : doubled;
    }

    private void pause(Duration backoff, TransientIOException cause) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientIOException(operation + " interrupted during backoff", cause);
        }
    }
}
