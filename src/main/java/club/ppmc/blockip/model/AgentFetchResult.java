/**
 * 单个agent的拉取结果：成功时携带IP段列表，失败时携带告警文本。
 * 拉取异常在agent处理边界内被转换为此结果，不会影响其它agent。
 */
package club.ppmc.blockip.model;

import java.util.List;

public record AgentFetchResult(String agent, List<String> ranges, String warning) {

    public static AgentFetchResult success(String agent, List<String> ranges) {
        return new AgentFetchResult(agent, List.copyOf(ranges), null);
    }

    public static AgentFetchResult warning(String agent, String warning) {
        return new AgentFetchResult(agent, List.of(), warning);
    }

    public boolean succeeded() {
        return warning == null;
    }
}
