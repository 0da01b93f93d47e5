/**
 * 在启动时读取一次上游地址映射 ({provider: {agent: url}})，之后只读。
 * 文件缺失或无法解析时得到空映射，此时刷新会以"没有任何agent成功"失败。
 */
package club.ppmc.blockip.service;

import club.ppmc.blockip.config.BlockIpProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.stereotype.Component;

@Component
public class RefreshSourceLoader {

    private static final Logger logger = LoggerFactory.getLogger(RefreshSourceLoader.class);
    private static final TypeReference<Map<String, LinkedHashMap<String, String>>> DOCUMENT_TYPE =
            new TypeReference<>() {};

    private final Map<String, String> sources;

    public RefreshSourceLoader(ObjectMapper objectMapper, BlockIpProperties properties) {
        var location = properties.refresh().sources();
        var provider = properties.dataset().provider();
        this.sources = Collections.unmodifiableMap(load(objectMapper, location, provider));
        logger.info("上游地址映射已加载: 位置[{}], 提供方[{}], agent {}", location, provider, sources.keySet());
    }

    /** agent -> 上游URL，保持文件中的顺序。 */
    public Map<String, String> sources() {
        return sources;
    }

    private static Map<String, String> load(ObjectMapper objectMapper, String location, String provider) {
        var resource = new DefaultResourceLoader().getResource(location);
        if (!resource.exists()) {
            logger.warn("上游地址映射 {} 不存在，刷新将无数据可拉取。", location);
            return new LinkedHashMap<>();
        }
        try (var in = resource.getInputStream()) {
            var document = objectMapper.readValue(in, DOCUMENT_TYPE);
            var urls = document == null ? null : document.get(provider);
            return urls == null ? new LinkedHashMap<>() : new LinkedHashMap<>(urls);
        } catch (IOException e) {
            logger.warn("上游地址映射 {} 无法解析，刷新将无数据可拉取。", location, e);
            return new LinkedHashMap<>();
        }
    }
}
