/**
 * 所有业务异常的基类，携带HTTP状态和机器可读的原因码。
 *
 * 关联:
 * - `GlobalExceptionHandler`: 统一将此类异常转换为错误响应。
 */
package club.ppmc.blockip.exception;

import org.springframework.http.HttpStatus;

public abstract class BlockIpException extends RuntimeException {

    private final HttpStatus status;
    private final String reason;

    protected BlockIpException(HttpStatus status, String reason, String message) {
        super(message);
        this.status = status;
        this.reason = reason;
    }

    protected BlockIpException(HttpStatus status, String reason, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.reason = reason;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }
}
