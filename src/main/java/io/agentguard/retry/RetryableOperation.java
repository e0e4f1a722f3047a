package io.agentguard.retry;

@FunctionalInterface
public interface RetryableOperation<T> {
    T call(int attempt) throws Exception;
}
