/**
 * 此文件定义了所有错误响应共用的JSON结构。
 *
 * 主要职责:
 * - 提供`code`(HTTP状态码)、`reason`(机器可读原因)和`message`(可读说明)。
 * - 配额拒绝时额外提供`reset_in_seconds`和`reset_time`，其余情况下这两个字段不会出现。
 *
 * 关联:
 * - `GlobalExceptionHandler`: 为Controller中抛出的异常构造此响应。
 * - `JsonResponseWriter`: 拦截器在中断请求时直接写出此响应。
 */
package club.ppmc.blockip.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        int code,
        String reason,
        String message,
        @JsonProperty("reset_in_seconds") Long resetInSeconds,
        @JsonProperty("reset_time") String resetTime) {

    public static ErrorResponse of(int code, String reason, String message) {
        return new ErrorResponse(code, reason, message, null, null);
    }
}
