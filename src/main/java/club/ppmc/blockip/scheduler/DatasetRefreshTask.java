/**
 * 此文件定义了定期刷新IP段数据集的定时任务。
 *
 * 主要职责:
 * - 按`blockip.refresh.cron`（UTC）定时调用`DatasetRefresher`，cron为"-"时禁用。
 *
 * 关联:
 * - `DatasetRefresher`: 执行实际的刷新。
 * - `BlockIpApplication`: 需要有`@EnableScheduling`注解来启用此定时任务。
 */
package club.ppmc.blockip.scheduler;

import club.ppmc.blockip.exception.BlockIpException;
import club.ppmc.blockip.service.DatasetRefresher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class DatasetRefreshTask {

    private static final Logger logger = LoggerFactory.getLogger(DatasetRefreshTask.class);

    private final DatasetRefresher datasetRefresher;

    public DatasetRefreshTask(DatasetRefresher datasetRefresher) {
        this.datasetRefresher = datasetRefresher;
    }

    @Scheduled(cron = "${blockip.refresh.cron:0 0 3 * * *}", zone = "UTC")
    public void refreshDataset() {
        logger.info("定时任务触发：开始刷新IP段数据集。");
        try {
            var report = datasetRefresher.refresh();
            logger.info("定时刷新完成: 更新 {}, 告警 {} 条。", report.updatedAgents(), report.warnings().size());
        } catch (BlockIpException e) {
            logger.warn("定时刷新未成功: {}", e.getMessage());
        } catch (Exception e) {
            // 捕获并记录所有异常，防止定时任务因未捕获的异常而停止后续执行。
            logger.error("执行定时刷新任务时发生错误。", e);
        }
    }
}
