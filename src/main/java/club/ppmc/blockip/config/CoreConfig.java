/**
 * 此文件提供核心组件共用的基础Bean。
 *
 * 主要职责:
 * - 提供UTC时钟，配额的"今天"和重置时间都基于此时钟计算，测试中可以替换为固定时钟。
 * - 提供上游请求之间的暂停策略，生产环境中真实休眠。
 * - 根据`blockip.cache`配置创建读缓存。
 */
package club.ppmc.blockip.config;

import club.ppmc.blockip.service.ResponseCache;
import club.ppmc.blockip.service.UpstreamPacer;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(BlockIpProperties.class)
public class CoreConfig {

    private static final Logger logger = LoggerFactory.getLogger(CoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public UpstreamPacer upstreamPacer() {
        return UpstreamPacer.sleeping();
    }

    @Bean
    public ResponseCache responseCache(BlockIpProperties properties) {
        var cache = properties.cache();
        if (!cache.enabled()) {
            logger.info("读缓存已禁用。");
            return ResponseCache.disabled();
        }
        logger.info("读缓存已启用: TTL[{}], 最大条目数[{}]", cache.ttl(), cache.maximumSize());
        return ResponseCache.expiring(cache.ttl(), cache.maximumSize());
    }
}
