/**
 * 此文件定义了拦截器链的第一阶段：凭证校验。
 *
 * 主要职责:
 * - 从请求头读取API凭证，交给`CredentialValidator`校验。
 * - 校验通过时将`AccountContext`放入请求属性，供后续的限流阶段和Controller使用。
 * - 校验失败时中断请求并返回`403 Forbidden`，原因码为`missing`或`invalid_or_inactive`。
 *
 * 关联:
 * - `WebConfig`: 注册此拦截器，顺序位于`TieredRateLimitInterceptor`之前。
 */
package club.ppmc.blockip.interceptor;

import club.ppmc.blockip.config.BlockIpProperties;
import club.ppmc.blockip.dto.ErrorResponse;
import club.ppmc.blockip.exception.CredentialInvalidException;
import club.ppmc.blockip.model.AccountContext;
import club.ppmc.blockip.service.CredentialValidator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class ApiKeyAuthInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(ApiKeyAuthInterceptor.class);

    private final CredentialValidator credentialValidator;
    private final JsonResponseWriter responseWriter;
    private final String headerName;

    public ApiKeyAuthInterceptor(
            CredentialValidator credentialValidator,
            JsonResponseWriter responseWriter,
            BlockIpProperties properties) {
        this.credentialValidator = credentialValidator;
        this.responseWriter = responseWriter;
        this.headerName = properties.auth().header();
        logger.info("凭证校验拦截器初始化，凭证请求头: {}", headerName);
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        if (HttpMethod.OPTIONS.matches(request.getMethod())) {
            return true;
        }

        try {
            var account = credentialValidator.validate(request.getHeader(headerName));
            request.setAttribute(AccountContext.REQUEST_ATTRIBUTE, account);
            return true;
        } catch (CredentialInvalidException e) {
            logger.warn("凭证校验失败: {} {}, 原因 {}", request.getMethod(), request.getRequestURI(), e.getReason());
            responseWriter.write(response,
                    ErrorResponse.of(e.getStatus().value(), e.getReason(), e.getMessage()));
            return false;
        }
    }
}
