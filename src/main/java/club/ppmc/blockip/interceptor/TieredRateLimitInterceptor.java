/**
 * 此文件定义了拦截器链的第二阶段：分级配额检查。
 *
 * 主要职责:
 * - 读取前一阶段放入的`AccountContext`，交给`TieredRateLimiter`占用一次配额。
 * - 超出配额时中断请求并返回`429 Too Many Requests`，响应中包含倒计时消息、重置秒数和重置时间，
 *   同时设置`Retry-After`头。
 *
 * 关联:
 * - `ApiKeyAuthInterceptor`: 必须先于此拦截器执行。
 * - `WebConfig`: 注册此拦截器。
 */
package club.ppmc.blockip.interceptor;

import club.ppmc.blockip.dto.ErrorResponse;
import club.ppmc.blockip.model.AccountContext;
import club.ppmc.blockip.service.TieredRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class TieredRateLimitInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(TieredRateLimitInterceptor.class);
    private static final String QUOTA_EXCEEDED = "quota_exceeded";

    private final TieredRateLimiter rateLimiter;
    private final JsonResponseWriter responseWriter;

    public TieredRateLimitInterceptor(TieredRateLimiter rateLimiter, JsonResponseWriter responseWriter) {
        this.rateLimiter = rateLimiter;
        this.responseWriter = responseWriter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }

        var account = (AccountContext) request.getAttribute(AccountContext.REQUEST_ATTRIBUTE);
        if (account == null) {
            // 拦截器注册顺序错误时才会出现
            throw new IllegalStateException("AccountContext missing; credential stage must run first");
        }

        var decision = rateLimiter.check(account);
        if (decision.admitted()) {
            return true;
        }

        logger.warn("速率限制已超出: 账户 '{}', 路径 {}", account.accountId(), request.getRequestURI());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.resetInSeconds()));
        responseWriter.write(response, new ErrorResponse(
                decision.status().value(),
                QUOTA_EXCEEDED,
                decision.message(),
                decision.resetInSeconds(),
                decision.resetAt().toString()));
        return false;
    }
}
