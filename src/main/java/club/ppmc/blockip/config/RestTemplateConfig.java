/**
 * 此文件定义了同步HTTP客户端`RestTemplate`的Spring配置。
 *
 * 主要职责:
 * - 创建用于拉取上游IP段数据的`RestTemplate` Bean (`upstreamRestTemplate`)。
 * - 统一设置连接/读取超时以及浏览器风格的默认请求头，部分上游会拒绝没有这些头的请求。
 *
 * 关联:
 * - `DatasetRefresher`: 注入并使用此Bean依次访问各agent的数据地址。
 * - `BlockIpProperties.Refresh`: 提供超时时间、User-Agent和Referer。
 */
package club.ppmc.blockip.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

@Configuration
public class RestTemplateConfig {

    private static final Logger logger = LoggerFactory.getLogger(RestTemplateConfig.class);

    /**
     * 创建上游专用的`RestTemplate`实例作为Spring Bean。
     *
     * @param builder    Spring Boot自动配置的`RestTemplateBuilder`。
     * @param properties 应用配置。
     * @return 配置好超时和默认请求头的`RestTemplate`对象。
     */
    @Bean("upstreamRestTemplate")
    public RestTemplate upstreamRestTemplate(RestTemplateBuilder builder, BlockIpProperties properties) {
        var refresh = properties.refresh();
        var configured = builder
                .setConnectTimeout(refresh.timeout())
                .setReadTimeout(refresh.timeout())
                .defaultHeader(HttpHeaders.USER_AGENT, refresh.userAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (refresh.referer() != null && !refresh.referer().isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.REFERER, refresh.referer());
        }
        logger.info("上游RestTemplate已配置，超时: {}", refresh.timeout());
        return configured.build();
    }
}
