/**
 * 通过读缓存查询IP段数据集，返回值即接口响应体。
 */
package club.ppmc.blockip.service;

import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class BlockIpQueryService {

    private static final String ALL_KEY = "block-ips";
    private static final String AGENT_KEY_PREFIX = "block-ips:";

    private final AddressRangeStore store;
    private final ResponseCache responseCache;

    public BlockIpQueryService(AddressRangeStore store, ResponseCache responseCache) {
        this.store = store;
        this.responseCache = responseCache;
    }

    /** {provider: {agent: [..]}} */
    public Map<String, Map<String, List<String>>> getAllRanges() {
        return responseCache.get(ALL_KEY, () -> store.getAll().toDocument());
    }

    /**
     * {agent: [..]}
     *
     * @throws club.ppmc.blockip.exception.AgentNotFoundException agent未知。
     */
    public Map<String, List<String>> getAgentRanges(String agent) {
        return responseCache.get(AGENT_KEY_PREFIX + agent, () -> Map.of(agent, store.getAgent(agent)));
    }
}
