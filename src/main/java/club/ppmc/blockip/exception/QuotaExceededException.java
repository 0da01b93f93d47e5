/**
 * 受保护的操作因当日配额用尽而被拒绝。
 *
 * 关联:
 * - `TieredRateLimiter#execute`: 拒绝时抛出，受保护的操作不会被调用。
 * - `GlobalExceptionHandler`: 转换为`429`，附带`Retry-After`头和重置时间。
 */
package club.ppmc.blockip.exception;

import java.time.Instant;
import org.springframework.http.HttpStatus;

public class QuotaExceededException extends BlockIpException {

    private final Instant resetAt;
    private final long resetInSeconds;

    public QuotaExceededException(String message, Instant resetAt, long resetInSeconds) {
        super(HttpStatus.TOO_MANY_REQUESTS, "quota_exceeded", message);
        this.resetAt = resetAt;
        this.resetInSeconds = resetInSeconds;
    }

    public Instant getResetAt() {
        return resetAt;
    }

    public long getResetInSeconds() {
        return resetInSeconds;
    }
}
