/**
 * 此文件定义了分级限流器的判定结果。
 *
 * 主要职责:
 * - 放行时仅携带配额决策。
 * - 拒绝时携带HTTP状态`429`、人类可读的倒计时消息以及重置时间，供拦截器直接写入响应。
 *
 * 关联:
 * - `TieredRateLimiter`: 产生此结果。
 * - `TieredRateLimitInterceptor`: 消费此结果。
 */
package club.ppmc.blockip.model;

import java.time.Instant;
import org.springframework.http.HttpStatus;

public record RateLimitDecision(
        boolean admitted,
        HttpStatus status,
        String message,
        Instant resetAt,
        long resetInSeconds) {

    public static RateLimitDecision admit(Instant resetAt, long resetInSeconds) {
        return new RateLimitDecision(true, HttpStatus.OK, null, resetAt, resetInSeconds);
    }

    public static RateLimitDecision deny(String message, Instant resetAt, long resetInSeconds) {
        return new RateLimitDecision(false, HttpStatus.TOO_MANY_REQUESTS, message, resetAt, resetInSeconds);
    }
}
