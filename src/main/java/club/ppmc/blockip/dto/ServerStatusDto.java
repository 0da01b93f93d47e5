/**
 * 此文件定义了用于表示服务器状态的数据传输对象(DTO)。
 *
 * 使用JDK 17的`record`类型，提供了简洁、不可变的数据结构。
 *
 * 关联:
 * - `MonitorController`: 使用此DTO作为其`/monitor/status`端点的响应体。
 */
package club.ppmc.blockip.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerStatusDto(
        String status,
        @JsonProperty("server_time") long serverTime,
        @JsonProperty("agent_range_counts") Map<String, Integer> agentRangeCounts,
        @JsonProperty("last_refresh_time") String lastRefreshTime,
        @JsonProperty("degraded_quota_admissions") long degradedQuotaAdmissions,
        @JsonProperty("error_message") String errorMessage) {

    /**
     * 创建一个表示成功状态的DTO实例。
     * @param serverTime 当前服务器时间戳。
     * @return 代表成功的`ServerStatusDto`对象。
     */
    public static ServerStatusDto success(
            long serverTime,
            Map<String, Integer> agentRangeCounts,
            String lastRefreshTime,
            long degradedQuotaAdmissions) {
        return new ServerStatusDto(
                "running", serverTime, agentRangeCounts, lastRefreshTime, degradedQuotaAdmissions, null);
    }

    /**
     * 创建一个表示错误状态的DTO实例。
     * @param message 错误信息。
     * @return 代表错误的`ServerStatusDto`对象。
     */
    public static ServerStatusDto error(String message) {
        return new ServerStatusDto("error", System.currentTimeMillis(), null, null, -1, message);
    }
}
