/**
 * 此文件定义了应用程序自定义配置的类型安全属性类。
 *
 * 主要职责:
 * - 使用 `@ConfigurationProperties` 将 `application.yml` 中以 "blockip" 为前缀的
 *   配置项自动、类型安全地绑定到此记录及其嵌套记录上。
 * - 启动时通过 `@Validated` 校验必填项，配置错误时应用直接启动失败。
 *
 * 关联:
 * - `AddressRangeStore`: 使用`dataset`配置定位数据文件和已知agent集合。
 * - `DatasetRefresher`, `RestTemplateConfig`, `RefreshSourceLoader`: 使用`refresh`配置。
 * - `UpdateSecretInterceptor`, `ApiKeyAuthInterceptor`: 使用`update`和`auth`配置。
 * - `application.yml`: 是此配置类的数据源。例如:
 *   ```yaml
 *   blockip:
 *     dataset:
 *       file: "block_ips.json"
 *       provider: "openai"
 *     update:
 *       secret: "${BLOCKIP_UPDATE_SECRET:}"
 *   ```
 */
package club.ppmc.blockip.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "blockip")
@Validated
public record BlockIpProperties(
        @Valid @NotNull @DefaultValue Dataset dataset,
        @Valid @NotNull @DefaultValue Refresh refresh,
        @Valid @NotNull @DefaultValue Auth auth,
        @Valid @NotNull @DefaultValue Update update,
        @Valid @NotNull @DefaultValue Cache cache) {

    /**
     * @param file     数据集JSON文件路径。
     * @param provider 文件中的顶层提供方键。
     * @param agents   固定的已知agent集合，顺序即响应中的顺序。
     */
    public record Dataset(
            @NotBlank @DefaultValue("block_ips.json") String file,
            @NotBlank @DefaultValue("openai") String provider,
            @NotEmpty @DefaultValue({"searchbot", "chatgpt-user", "gptbot"}) List<String> agents) {}

    /**
     * @param sources   上游地址映射文件的资源位置 (支持`classpath:`和`file:`前缀)。
     * @param timeout   单次上游请求的超时时间。
     * @param pause     相邻两次上游请求之间的间隔。
     * @param cron      定时刷新的cron表达式，"-"表示禁用。
     * @param warmupUrl 刷新开始前预先访问的地址，可为空。
     */
    public record Refresh(
            @NotBlank @DefaultValue("classpath:ai_urls.json") String sources,
            @NotNull @DefaultValue("10s") Duration timeout,
            @NotNull @DefaultValue("1s") Duration pause,
            @NotBlank @DefaultValue("0 0 3 * * *") String cron,
            String warmupUrl,
            @NotBlank @DefaultValue("Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36") String userAgent,
            String referer) {}

    public record Auth(@NotBlank @DefaultValue("X-API-Key") String header) {}

    /**
     * @param header 携带更新密钥的请求头名称。
     * @param secret 更新密钥，未配置时所有更新请求都会被拒绝。
     */
    public record Update(@NotBlank @DefaultValue("X-Update-Secret") String header, String secret) {}

    public record Cache(
            @DefaultValue("true") boolean enabled,
            @NotNull @DefaultValue("1h") Duration ttl,
            @DefaultValue("1000") long maximumSize) {}
}
