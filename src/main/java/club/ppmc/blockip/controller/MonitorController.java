/**
 * 此文件提供了用于监控服务器状态的API端点。
 *
 * 主要职责:
 * - 提供`/health`接口，供负载均衡器做存活检查，无需凭证。
 * - 提供`/monitor/status`接口，返回各agent的IP段数量、最近一次成功刷新时间和降级放行次数。
 *
 * 关联:
 * - `AddressRangeStore`, `DatasetRefresher`, `QuotaLedger`: 状态数据的来源。
 * - `ServerStatusDto`: 作为`/monitor/status`的响应数据结构。
 */
package club.ppmc.blockip.controller;

import club.ppmc.blockip.dto.ServerStatusDto;
import club.ppmc.blockip.service.AddressRangeStore;
import club.ppmc.blockip.service.DatasetRefresher;
import club.ppmc.blockip.service.QuotaLedger;
import java.time.Clock;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MonitorController {

    private static final Logger logger = LoggerFactory.getLogger(MonitorController.class);

    private final AddressRangeStore addressRangeStore;
    private final DatasetRefresher datasetRefresher;
    private final QuotaLedger quotaLedger;
    private final Clock clock;

    public MonitorController(
            AddressRangeStore addressRangeStore,
            DatasetRefresher datasetRefresher,
            QuotaLedger quotaLedger,
            Clock clock) {
        this.addressRangeStore = addressRangeStore;
        this.datasetRefresher = datasetRefresher;
        this.quotaLedger = quotaLedger;
        this.clock = clock;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }

    /**
     * 获取服务器状态。
     * @return 包含服务器状态的`ServerStatusDto`对象。
     */
    @GetMapping("/monitor/status")
    public ServerStatusDto getServerStatus() {
        logger.info("收到获取服务器状态的请求 /monitor/status");
        try {
            var lastRefresh = datasetRefresher.lastSuccessfulRefresh()
                    .map(Object::toString)
                    .orElse(null);
            return ServerStatusDto.success(
                    clock.millis(),
                    addressRangeStore.rangeCounts(),
                    lastRefresh,
                    quotaLedger.degradedAdmissions());
        } catch (RuntimeException e) {
            logger.error("获取服务器状态时发生未知错误。", e);
            return ServerStatusDto.error(e.getMessage());
        }
    }
}
