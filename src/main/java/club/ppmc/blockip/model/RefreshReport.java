/**
 * 一次成功（含部分成功）刷新的汇总。
 *
 * @param dataset        合并后的数据集（未发生变化时即为刷新前的数据集）。
 * @param fetchedAgents  拉取到非空列表的agent。
 * @param updatedAgents  列表与刷新前不同、因而被替换的agent。
 * @param warnings       各agent累积的告警。
 */
package club.ppmc.blockip.model;

import java.util.List;

public record RefreshReport(
        AddressRangeDataset dataset,
        List<String> fetchedAgents,
        List<String> updatedAgents,
        List<String> warnings) {

    public RefreshReport {
        fetchedAgents = List.copyOf(fetchedAgents);
        updatedAgents = List.copyOf(updatedAgents);
        warnings = List.copyOf(warnings);
    }

    public boolean updated() {
        return !updatedAgents.isEmpty();
    }
}
