/**
 * 此文件定义了爬虫IP段数据集的不可变快照。
 *
 * 主要职责:
 * - 保存一个提供方(provider，如"openai")下 agent -> CIDR列表 的有序映射。
 * - 所有集合在构造时被复制为不可变集合，因此快照可以在线程之间安全共享。
 *
 * 关联:
 * - `AddressRangeStore`: 持有当前快照并在合并成功后原子替换。
 * - `DatasetRefresher`: 基于旧快照构造合并后的新快照。
 */
package club.ppmc.blockip.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record AddressRangeDataset(String provider, Map<String, List<String>> agents) {

    public AddressRangeDataset {
        Objects.requireNonNull(provider, "provider");
        var copy = new LinkedHashMap<String, List<String>>();
        agents.forEach((agent, ranges) -> copy.put(agent, List.copyOf(ranges)));
        agents = Collections.unmodifiableMap(copy);
    }

    /** 为每个已知agent创建空列表的数据集。 */
    public static AddressRangeDataset empty(String provider, List<String> knownAgents) {
        var agents = new LinkedHashMap<String, List<String>>();
        knownAgents.forEach(agent -> agents.put(agent, List.of()));
        return new AddressRangeDataset(provider, agents);
    }

    public boolean hasAgent(String agent) {
        return agents.containsKey(agent);
    }

    /** 返回替换了指定agent列表的新快照，原快照不变。 */
    public AddressRangeDataset withAgent(String agent, List<String> ranges) {
        var copy = new LinkedHashMap<>(agents);
        copy.put(agent, ranges);
        return new AddressRangeDataset(provider, copy);
    }

    /** 持久化文件的结构: {provider: {agent: [..]}}。 */
    public Map<String, Map<String, List<String>>> toDocument() {
        return Map.of(provider, agents);
    }
}
