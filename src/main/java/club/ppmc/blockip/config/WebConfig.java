/**
 * 此文件定义了Spring Web MVC的核心配置。
 *
 * 主要职责:
 * - 按顺序注册拦截器链：读接口先经过凭证校验，再经过分级配额检查；
 *   更新接口只经过更新密钥校验，不消耗配额。
 * - `/health`与`/monitor/**`不注册任何拦截器。
 *
 * 关联:
 * - `ApiKeyAuthInterceptor`, `TieredRateLimitInterceptor`, `UpdateSecretInterceptor`: 在此被注册。
 */
package club.ppmc.blockip.config;

import club.ppmc.blockip.interceptor.ApiKeyAuthInterceptor;
import club.ppmc.blockip.interceptor.TieredRateLimitInterceptor;
import club.ppmc.blockip.interceptor.UpdateSecretInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(WebConfig.class);

    private static final String[] METERED_PATH_PATTERNS =
            new String[] {"/block-ips", "/block-ips/**", "/usage", "/api-usage"};
    private static final String UPDATE_PATH_PATTERN = "/update-ips";

    private final ApiKeyAuthInterceptor apiKeyAuthInterceptor;
    private final TieredRateLimitInterceptor tieredRateLimitInterceptor;
    private final UpdateSecretInterceptor updateSecretInterceptor;

    public WebConfig(
            ApiKeyAuthInterceptor apiKeyAuthInterceptor,
            TieredRateLimitInterceptor tieredRateLimitInterceptor,
            UpdateSecretInterceptor updateSecretInterceptor) {
        this.apiKeyAuthInterceptor = apiKeyAuthInterceptor;
        this.tieredRateLimitInterceptor = tieredRateLimitInterceptor;
        this.updateSecretInterceptor = updateSecretInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(apiKeyAuthInterceptor)
                .addPathPatterns(METERED_PATH_PATTERNS)
                .order(1);
        registry.addInterceptor(tieredRateLimitInterceptor)
                .addPathPatterns(METERED_PATH_PATTERNS)
                .order(2);
        registry.addInterceptor(updateSecretInterceptor)
                .addPathPatterns(UPDATE_PATH_PATTERN);
        logger.info("拦截器链已注册: 凭证校验 -> 配额检查 作用于 {}, 更新密钥校验 作用于 {}",
                String.join(", ", METERED_PATH_PATTERNS), UPDATE_PATH_PATTERN);
    }
}
