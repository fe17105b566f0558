package com.ryuqq.toolgate.application.config;

import com.ryuqq.toolgate.core.protection.RateLimiterConfig;
import com.ryuqq.toolgate.core.retry.RetryPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 환경 변수 기반 ToolGate 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <table>
 *   <caption>환경 변수</caption>
 *   <tr><th>변수</th><th>범위</th><th>기본값</th></tr>
 *   <tr><td>RATE_LIMIT_MAX_TOKENS</td><td>정수 1 ~ 100</td><td>10</td></tr>
 *   <tr><td>RATE_LIMIT_REFILL_RATE</td><td>0.1 ~ 10 (초당 토큰)</td><td>1</td></tr>
 *   <tr><td>RETRY_MAX_ATTEMPTS</td><td>정수 1 ~ 10</td><td>3</td></tr>
 *   <tr><td>RETRY_INITIAL_DELAY_MS</td><td>정수 0 ~ 60000</td><td>1000</td></tr>
 *   <tr><td>RETRY_MAX_DELAY_MS</td><td>정수 RETRY_INITIAL_DELAY_MS ~ 300000</td><td>30000</td></tr>
 * </table>
 *
 * <p>잘못된 값은 첫 항목에서 멈추지 않고 모두 모아 하나의 {@link IllegalArgumentException}으로 보고합니다.
 * 빈 문자열은 미설정으로 취급합니다.</p>
 *
 * @author ToolGate Team
 * @since 1.0.0
 * @param rateLimitMaxTokens 버킷 최대 토큰 수
 * @param rateLimitRefillRate 초당 보충 토큰 수
 * @param retryMaxAttempts 최대 시도 횟수
 * @param retryInitialDelayMs 첫 재시도 대기 (밀리초)
 * @param retryMaxDelayMs 재시도 대기 상한 (밀리초)
 */
public record ToolGateProperties(
    int rateLimitMaxTokens,
    double rateLimitRefillRate,
    int retryMaxAttempts,
    long retryInitialDelayMs,
    long retryMaxDelayMs
) {

    public static final String RATE_LIMIT_MAX_TOKENS = "RATE_LIMIT_MAX_TOKENS";
    public static final String RATE_LIMIT_REFILL_RATE = "RATE_LIMIT_REFILL_RATE";
    public static final String RETRY_MAX_ATTEMPTS = "RETRY_MAX_ATTEMPTS";
    public static final String RETRY_INITIAL_DELAY_MS = "RETRY_INITIAL_DELAY_MS";
    public static final String RETRY_MAX_DELAY_MS = "RETRY_MAX_DELAY_MS";

    private static final int DEFAULT_MAX_TOKENS = 10;
    private static final double DEFAULT_REFILL_RATE = 1.0;
    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final long DEFAULT_INITIAL_DELAY_MS = 1000;
    private static final long DEFAULT_MAX_DELAY_MS = 30000;

    /**
     * 기본 설정 생성자.
     */
    public ToolGateProperties() {
        this(DEFAULT_MAX_TOKENS, DEFAULT_REFILL_RATE, DEFAULT_MAX_ATTEMPTS,
            DEFAULT_INITIAL_DELAY_MS, DEFAULT_MAX_DELAY_MS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 범위를 벗어난 항목이 하나라도 있는 경우
     */
    public ToolGateProperties {
        List<String> errors = new ArrayList<>();
        collectViolations(rateLimitMaxTokens, rateLimitRefillRate, retryMaxAttempts,
            retryInitialDelayMs, retryMaxDelayMs, errors);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(formatErrors(errors));
        }
    }

    /**
     * 프로세스 환경 변수에서 설정 로드.
     *
     * @return ToolGateProperties
     * @throws IllegalArgumentException 검증 실패 시
     */
    public static ToolGateProperties fromSystemEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * 환경 변수 맵에서 설정 로드.
     *
     * <p>파싱 오류와 범위 오류를 모두 수집한 뒤 한 번에 보고합니다.</p>
     *
     * @param env 환경 변수 맵
     * @return ToolGateProperties
     * @throws IllegalArgumentException env가 null이거나 검증 실패 시
     */
    public static ToolGateProperties fromEnvironment(Map<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        List<String> errors = new ArrayList<>();

        int maxTokens = (int) readLong(env, RATE_LIMIT_MAX_TOKENS, DEFAULT_MAX_TOKENS, errors);
        double refillRate = readDouble(env, RATE_LIMIT_REFILL_RATE, DEFAULT_REFILL_RATE, errors);
        int maxAttempts = (int) readLong(env, RETRY_MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS, errors);
        long initialDelayMs = readLong(env, RETRY_INITIAL_DELAY_MS, DEFAULT_INITIAL_DELAY_MS, errors);
        long maxDelayMs = readLong(env, RETRY_MAX_DELAY_MS, DEFAULT_MAX_DELAY_MS, errors);

        collectViolations(maxTokens, refillRate, maxAttempts, initialDelayMs, maxDelayMs, errors);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(formatErrors(errors));
        }
        return new ToolGateProperties(maxTokens, refillRate, maxAttempts, initialDelayMs, maxDelayMs);
    }

    /**
     * Rate Limiter 설정으로 변환.
     *
     * @return RateLimiterConfig
     */
    public RateLimiterConfig toRateLimiterConfig() {
        return new RateLimiterConfig(rateLimitMaxTokens, rateLimitRefillRate);
    }

    /**
     * 기본 재시도 정책에 이 설정의 횟수/대기 값을 적용.
     *
     * @return RetryPolicy (배수 2.0, 모든 오류 재시도)
     */
    public RetryPolicy toRetryPolicy() {
        RetryPolicy defaults = new RetryPolicy();
        return new RetryPolicy(
            retryMaxAttempts,
            retryInitialDelayMs,
            retryMaxDelayMs,
            defaults.backoffMultiplier(),
            defaults.retryCondition(),
            defaults.cancellationToken(),
            defaults.listener()
        );
    }

    private static void collectViolations(
        long maxTokens,
        double refillRate,
        long maxAttempts,
        long initialDelayMs,
        long maxDelayMs,
        List<String> errors
    ) {
        if (maxTokens < 1) {
            errors.add(RATE_LIMIT_MAX_TOKENS + " must be at least 1 (current: " + maxTokens + ")");
        } else if (maxTokens > 100) {
            errors.add(RATE_LIMIT_MAX_TOKENS + " cannot exceed 100 (current: " + maxTokens + ")");
        }
        if (!(refillRate >= 0.1)) {
            errors.add(RATE_LIMIT_REFILL_RATE + " must be at least 0.1 (current: " + refillRate + ")");
        } else if (refillRate > 10) {
            errors.add(RATE_LIMIT_REFILL_RATE + " cannot exceed 10 (current: " + refillRate + ")");
        }
        if (maxAttempts < 1) {
            errors.add(RETRY_MAX_ATTEMPTS + " must be at least 1 (current: " + maxAttempts + ")");
        } else if (maxAttempts > 10) {
            errors.add(RETRY_MAX_ATTEMPTS + " cannot exceed 10 (current: " + maxAttempts + ")");
        }
        if (initialDelayMs < 0) {
            errors.add(RETRY_INITIAL_DELAY_MS + " must not be negative (current: " + initialDelayMs + ")");
        } else if (initialDelayMs > 60_000) {
            errors.add(RETRY_INITIAL_DELAY_MS + " cannot exceed 60000 (current: " + initialDelayMs + ")");
        }
        if (maxDelayMs < initialDelayMs) {
            errors.add(RETRY_MAX_DELAY_MS + " must be >= " + RETRY_INITIAL_DELAY_MS
                + " (initial: " + initialDelayMs + ", max: " + maxDelayMs + ")");
        } else if (maxDelayMs > 300_000) {
            errors.add(RETRY_MAX_DELAY_MS + " cannot exceed 300000 (current: " + maxDelayMs + ")");
        }
    }

    private static long readLong(Map<String, String> env, String name, long defaultValue, List<String> errors) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
                errors.add(name + " is out of range (current: " + raw + ")");
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            errors.add(name + " must be an integer (current: " + raw + ")");
            return defaultValue;
        }
    }

    private static double readDouble(Map<String, String> env, String name, double defaultValue, List<String> errors) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                errors.add(name + " must be a finite number (current: " + raw + ")");
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            errors.add(name + " must be a number (current: " + raw + ")");
            return defaultValue;
        }
    }

    private static String formatErrors(List<String> errors) {
        StringBuilder message = new StringBuilder("Configuration validation failed:");
        for (String error : errors) {
            message.append("\n  - ").append(error);
        }
        return message.toString();
    }
}
