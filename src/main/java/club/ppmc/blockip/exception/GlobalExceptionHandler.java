/**
 * 此文件将Controller和拦截器中抛出的异常统一转换为`ErrorResponse`。
 *
 * 主要职责:
 * - 业务异常 (`BlockIpException`) 使用其自带的状态码和原因码。
 * - 配额拒绝 (`QuotaExceededException`) 额外带上重置时间和`Retry-After`头。
 * - 持久层异常 (`DataAccessException`) 转换为503 `persistence_unavailable`。
 * - 其它未预期的异常转换为500，不向调用方暴露细节。
 */
package club.ppmc.blockip.exception;

import club.ppmc.blockip.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BlockIpException.class)
    public ResponseEntity<ErrorResponse> handleBlockIpException(BlockIpException e) {
        logger.warn("业务异常: {} | {}", e.getReason(), e.getMessage());
        return toResponse(e.getStatus(), e.getReason(), e.getMessage());
    }

    @ExceptionHandler(QuotaExceededException.class)
    public ResponseEntity<ErrorResponse> handleQuotaExceededException(QuotaExceededException e) {
        logger.warn("配额已用尽: {}", e.getMessage());
        return ResponseEntity.status(e.getStatus())
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getResetInSeconds()))
                .body(new ErrorResponse(
                        e.getStatus().value(),
                        e.getReason(),
                        e.getMessage(),
                        e.getResetInSeconds(),
                        e.getResetAt().toString()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e) {
        logger.error("持久层不可用。", e);
        return toResponse(HttpStatus.SERVICE_UNAVAILABLE, "persistence_unavailable",
                "Storage is temporarily unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        // 框架自身的异常 (如未知路径、方法不支持) 保留其状态码
        if (e instanceof org.springframework.web.ErrorResponse frameworkError) {
            var status = HttpStatus.resolve(frameworkError.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.BAD_REQUEST;
            }
            logger.debug("请求无法处理: {}", e.getMessage());
            return toResponse(status, "request_rejected", status.getReasonPhrase());
        }
        logger.error("未预期的系统异常。", e);
        return toResponse(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> toResponse(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(status.value(), reason, message));
    }
}
