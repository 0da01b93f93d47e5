/**
 * 此文件定义了IP段查询与更新的API端点。
 *
 * 主要职责:
 * - `GET /block-ips`: 返回完整数据集。
 * - `GET /block-ips/{agent}`: 返回单个agent的IP段，agent未知时404。
 * - `GET /update-ips`: 触发一次刷新，部分成功也返回200，全部失败返回503。
 *
 * 关联:
 * - `BlockIpQueryService`: 带缓存的读取。
 * - `DatasetRefresher`: 执行刷新。
 * - `WebConfig`: 为这些路径注册了凭证、配额和更新密钥拦截器。
 */
package club.ppmc.blockip.controller;

import club.ppmc.blockip.dto.UpdateResponse;
import club.ppmc.blockip.service.BlockIpQueryService;
import club.ppmc.blockip.service.DatasetRefresher;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BlockIpController {

    private static final Logger logger = LoggerFactory.getLogger(BlockIpController.class);

    private final BlockIpQueryService queryService;
    private final DatasetRefresher datasetRefresher;

    public BlockIpController(BlockIpQueryService queryService, DatasetRefresher datasetRefresher) {
        this.queryService = queryService;
        this.datasetRefresher = datasetRefresher;
    }

    @GetMapping("/block-ips")
    public Map<String, Map<String, List<String>>> getBlockIps() {
        logger.debug("收到获取完整IP段数据集的请求 /block-ips");
        return queryService.getAllRanges();
    }

    @GetMapping("/block-ips/{agent}")
    public Map<String, List<String>> getAgentIps(@PathVariable("agent") String agent) {
        logger.debug("收到获取agent '{}' IP段的请求", agent);
        return queryService.getAgentRanges(agent);
    }

    /**
     * 刷新IP数据。失败的情况由`GlobalExceptionHandler`转换为503/409。
     */
    @GetMapping("/update-ips")
    public UpdateResponse updateIps() {
        logger.info("收到IP数据更新请求 /update-ips");
        var report = datasetRefresher.refresh();
        var message = report.warnings().isEmpty()
                ? "IP data update completed successfully"
                : "IP data update completed with partial success";
        return new UpdateResponse(
                message,
                report.dataset().agents(),
                report.warnings().isEmpty() ? null : report.warnings());
    }
}
