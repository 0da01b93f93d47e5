/**
 * 保护`/update-ips`：要求请求头携带独立的更新密钥（与分级API凭证无关），不匹配时返回403。
 * 未配置密钥时拒绝所有更新请求。
 */
package club.ppmc.blockip.interceptor;

import club.ppmc.blockip.config.BlockIpProperties;
import club.ppmc.blockip.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
public class UpdateSecretInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(UpdateSecretInterceptor.class);

    private final JsonResponseWriter responseWriter;
    private final String headerName;
    private final byte[] secret;

    public UpdateSecretInterceptor(JsonResponseWriter responseWriter, BlockIpProperties properties) {
        this.responseWriter = responseWriter;
        this.headerName = properties.update().header();
        var configured = properties.update().secret();
        this.secret = configured == null || configured.isBlank()
                ? null
                : configured.getBytes(StandardCharsets.UTF_8);
        if (this.secret == null) {
            logger.warn("未配置更新密钥 (blockip.update.secret)，所有更新请求都将被拒绝！");
        }
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        var provided = request.getHeader(headerName);
        if (secret != null && provided != null
                && MessageDigest.isEqual(secret, provided.getBytes(StandardCharsets.UTF_8))) {
            return true;
        }

        logger.warn("更新密钥校验失败，来源 {}", request.getRemoteAddr());
        responseWriter.write(response, ErrorResponse.of(
                HttpStatus.FORBIDDEN.value(), "invalid_update_secret", "Invalid update secret"));
        return false;
    }
}
