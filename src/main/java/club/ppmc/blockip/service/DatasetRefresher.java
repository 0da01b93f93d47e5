/**
 * 此服务负责从上游拉取各agent的IP段并合并到数据集中。
 *
 * 主要职责:
 * - 依次访问每个agent的上游地址，相邻请求之间至少暂停1秒，单次请求超时由`RestTemplate`控制。
 * - 每个agent的结果相互独立：HTTP错误、传输错误、响应无法解析或列表为空都只记为一条告警，
 *   不会中断其余agent；拉取失败的agent保留刷新前的列表。
 * - 至少一个agent拉取成功即视为成功（部分成功也是成功），有列表发生变化时持久化整个合并结果；
 *   全部失败时抛出`DatasetUpdateFailedException`，磁盘上的数据集保持不变。
 * - 同一时刻只允许一次刷新，并发的第二次调用直接被拒绝。
 *
 * 关联:
 * - `AddressRangeStore`: 提供刷新前的快照并接收合并结果。
 * - `RefreshSourceLoader`: 提供 agent -> URL 映射。
 * - `RestTemplateConfig`: 提供`upstreamRestTemplate`。
 * - `DatasetRefreshTask`, `BlockIpController`: 触发刷新。
 */
package club.ppmc.blockip.service;

import club.ppmc.blockip.config.BlockIpProperties;
import club.ppmc.blockip.exception.DatasetUpdateFailedException;
import club.ppmc.blockip.exception.RefreshInProgressException;
import club.ppmc.blockip.model.AgentFetchResult;
import club.ppmc.blockip.model.RefreshReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Service
public class DatasetRefresher {

    private static final Logger logger = LoggerFactory.getLogger(DatasetRefresher.class);
    private static final Duration MIN_PAUSE = Duration.ofSeconds(1);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final AddressRangeStore store;
    private final RefreshSourceLoader sourceLoader;
    private final UpstreamPacer pacer;
    private final Clock clock;
    private final Duration pause;
    private final String warmupUrl;

    private final ReentrantLock refreshLock = new ReentrantLock();
    private final AtomicReference<Instant> lastSuccessfulRefresh = new AtomicReference<>();

    public DatasetRefresher(
            @Qualifier("upstreamRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            AddressRangeStore store,
            RefreshSourceLoader sourceLoader,
            UpstreamPacer pacer,
            Clock clock,
            BlockIpProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.store = store;
        this.sourceLoader = sourceLoader;
        this.pacer = pacer;
        this.clock = clock;
        var configured = properties.refresh().pause();
        this.pause = configured.compareTo(MIN_PAUSE) < 0 ? MIN_PAUSE : configured;
        this.warmupUrl = properties.refresh().warmupUrl();
    }

    /**
     * 执行一次刷新。
     *
     * @return 合并结果与告警。
     * @throws RefreshInProgressException   已有刷新在进行中。
     * @throws DatasetUpdateFailedException 没有任何agent拉取到数据。
     * @throws club.ppmc.blockip.exception.DatasetPersistenceException 合并结果无法写盘。
     */
    public RefreshReport refresh() {
        if (!refreshLock.tryLock()) {
            logger.warn("已有IP数据刷新在进行中，本次请求被拒绝。");
            throw new RefreshInProgressException();
        }
        try {
            return doRefresh();
        } finally {
            refreshLock.unlock();
        }
    }

    public Optional<Instant> lastSuccessfulRefresh() {
        return Optional.ofNullable(lastSuccessfulRefresh.get());
    }

    private RefreshReport doRefresh() {
        var sources = sourceLoader.sources();
        var merged = store.getAll();
        var warnings = new ArrayList<String>();
        var fetchedAgents = new ArrayList<String>();
        var updatedAgents = new ArrayList<String>();

        logger.info("开始刷新IP数据，共 {} 个上游。", sources.size());
        warmUp();

        var first = true;
        for (var source : sources.entrySet()) {
            var agent = source.getKey();
            if (!merged.hasAgent(agent)) {
                logger.warn("上游映射中的agent '{}' 不在已知集合中，已跳过。", agent);
                warnings.add("Unknown bot type skipped: " + agent);
                continue;
            }
            if (!first) {
                try {
                    pacer.pause(pause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("IP数据刷新在拉取 '{}' 之前被中断。", agent);
                    warnings.add("Update interrupted before fetching " + agent);
                    break;
                }
            }
            first = false;

            var result = fetchAgent(agent, source.getValue());
            if (!result.succeeded()) {
                warnings.add(result.warning());
                continue;
            }
            fetchedAgents.add(agent);
            if (result.ranges().equals(merged.agents().get(agent))) {
                logger.info("agent '{}' 的IP段没有变化 ({} 条)。", agent, result.ranges().size());
            } else {
                merged = merged.withAgent(agent, result.ranges());
                updatedAgents.add(agent);
                logger.info("agent '{}' 的IP段已更新为 {} 条。", agent, result.ranges().size());
            }
        }

        if (fetchedAgents.isEmpty()) {
            logger.error("IP数据刷新失败，没有任何agent拿到有效数据: {}", warnings);
            throw new DatasetUpdateFailedException(warnings);
        }

        if (!updatedAgents.isEmpty()) {
            store.replace(merged);
        }
        lastSuccessfulRefresh.set(clock.instant());
        logger.info("IP数据刷新完成: 成功 {}, 更新 {}, 告警 {} 条。", fetchedAgents, updatedAgents, warnings.size());
        return new RefreshReport(merged, fetchedAgents, updatedAgents, warnings);
    }

    /**
     * 拉取单个agent。所有异常都在此转换为告警，不会影响其它agent。
     */
    AgentFetchResult fetchAgent(String agent, String url) {
        logger.info("正在从 {} 拉取 '{}' 的数据。", url, agent);
        try {
            var body = restTemplate.getForObject(url, String.class);
            var ranges = extractRanges(body);
            if (ranges.isEmpty()) {
                logger.warn("'{}' 的响应中没有IP数据。", agent);
                return AgentFetchResult.warning(agent, "No IP data found for " + agent);
            }
            return AgentFetchResult.success(agent, ranges);
        } catch (HttpStatusCodeException e) {
            logger.warn("拉取 '{}' 时上游返回 {}。", agent, e.getStatusCode());
            return AgentFetchResult.warning(agent,
                    "HTTP error occurred for " + agent + ": " + e.getStatusCode().value() + " " + e.getStatusText());
        } catch (ResourceAccessException e) {
            logger.warn("拉取 '{}' 时发生传输错误: {}", agent, e.getMessage());
            return AgentFetchResult.warning(agent, "Transport error occurred for " + agent + ": " + e.getMessage());
        } catch (JsonProcessingException e) {
            logger.error("'{}' 的响应不是有效的JSON: {}", agent, e.getOriginalMessage());
            return AgentFetchResult.warning(agent, "JSON decode error for " + agent + ": " + e.getOriginalMessage());
        } catch (RestClientException | IllegalArgumentException e) {
            logger.error("拉取 '{}' 时发生意外错误。", agent, e);
            return AgentFetchResult.warning(agent, "Unexpected error occurred for " + agent + ": " + e.getMessage());
        }
    }

    /**
     * 从 {"prefixes": [{"ipv4Prefix": ".."}, ..]} 中提取IP段，没有ipv4Prefix的条目使用ipv6Prefix。
     */
    private List<String> extractRanges(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        var root = objectMapper.readTree(body);
        var prefixes = root.path("prefixes");
        if (!prefixes.isArray()) {
            return List.of();
        }
        var ranges = new ArrayList<String>();
        for (JsonNode prefix : prefixes) {
            var range = prefix.hasNonNull("ipv4Prefix") ? prefix.get("ipv4Prefix") : prefix.get("ipv6Prefix");
            if (range != null && range.isTextual() && !range.asText().isBlank()) {
                ranges.add(range.asText());
            }
        }
        return ranges;
    }

    private void warmUp() {
        if (warmupUrl == null || warmupUrl.isBlank()) {
            return;
        }
        try {
            restTemplate.getForObject(warmupUrl, String.class);
            logger.debug("预热请求 {} 完成。", warmupUrl);
        } catch (RestClientException e) {
            logger.warn("预热请求 {} 失败，继续刷新: {}", warmupUrl, e.getMessage());
        }
    }
}
