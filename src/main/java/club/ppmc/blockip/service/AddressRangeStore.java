/**
 * 此服务持有爬虫IP段数据集的当前快照。
 *
 * 主要职责:
 * - 启动时从JSON文件加载数据集；文件不存在或损坏时使用每个已知agent都为空列表的数据集。
 * - 读操作只访问内存中的不可变快照，不涉及网络或磁盘I/O。
 * - 合并后的数据集先以"临时文件 + 原子移动"的方式写盘，成功后才替换内存快照，
 *   因此读者只会看到刷新前或刷新后的完整数据，写盘失败时内存快照保持不变。
 *
 * 关联:
 * - `DatasetRefresher`: 唯一的写入方，调用`replace`。
 * - `BlockIpQueryService`: 读取快照。
 */
package club.ppmc.blockip.service;

import club.ppmc.blockip.config.BlockIpProperties;
import club.ppmc.blockip.exception.AgentNotFoundException;
import club.ppmc.blockip.exception.DatasetPersistenceException;
import club.ppmc.blockip.model.AddressRangeDataset;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AddressRangeStore {

    private static final Logger logger = LoggerFactory.getLogger(AddressRangeStore.class);
    private static final TypeReference<Map<String, Map<String, List<String>>>> DOCUMENT_TYPE =
            new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Path file;
    private final String provider;
    private final List<String> knownAgents;
    private final AtomicReference<AddressRangeDataset> snapshot;

    public AddressRangeStore(ObjectMapper objectMapper, BlockIpProperties properties) {
        this.objectMapper = objectMapper;
        this.file = Path.of(properties.dataset().file()).toAbsolutePath();
        this.provider = properties.dataset().provider();
        this.knownAgents = List.copyOf(properties.dataset().agents());
        this.snapshot = new AtomicReference<>(load());
        logger.info("IP段数据集已加载: 文件[{}], agent条目数{}", file, rangeCounts());
    }

    public AddressRangeDataset getAll() {
        return snapshot.get();
    }

    /**
     * @throws AgentNotFoundException agent不在已知集合中。已知但没有IP段的agent返回空列表。
     */
    public List<String> getAgent(String agent) {
        var ranges = snapshot.get().agents().get(agent);
        if (ranges == null) {
            throw new AgentNotFoundException(agent);
        }
        return ranges;
    }

    public List<String> knownAgents() {
        return knownAgents;
    }

    /** agent -> IP段数量，用于日志和监控。 */
    public Map<String, Integer> rangeCounts() {
        var counts = new LinkedHashMap<String, Integer>();
        snapshot.get().agents().forEach((agent, ranges) -> counts.put(agent, ranges.size()));
        return counts;
    }

    /**
     * 持久化合并后的数据集并替换内存快照。
     *
     * @throws DatasetPersistenceException 写盘失败，内存快照和磁盘文件均保持不变。
     */
    synchronized void replace(AddressRangeDataset merged) {
        write(merged);
        snapshot.set(merged);
        logger.info("IP段数据集已持久化并替换: {}", rangeCounts());
    }

    private AddressRangeDataset load() {
        if (!Files.exists(file)) {
            logger.info("数据集文件 {} 不存在，使用空数据集。", file);
            return AddressRangeDataset.empty(provider, knownAgents);
        }
        try {
            var document = objectMapper.readValue(file.toFile(), DOCUMENT_TYPE);
            var stored = document == null ? null : document.get(provider);
            if (stored == null) {
                logger.warn("数据集文件 {} 中缺少提供方 '{}'，使用空数据集。", file, provider);
                return AddressRangeDataset.empty(provider, knownAgents);
            }

            var agents = new LinkedHashMap<String, List<String>>();
            for (var agent : knownAgents) {
                var ranges = stored.get(agent);
                agents.put(agent, ranges == null ? List.of() : ranges);
            }
            stored.keySet().stream()
                    .filter(agent -> !knownAgents.contains(agent))
                    .forEach(agent -> logger.warn("忽略数据集文件中的未知agent '{}'。", agent));
            return new AddressRangeDataset(provider, agents);
        } catch (IOException | RuntimeException e) {
            logger.warn("数据集文件 {} 无法解析，使用空数据集。", file, e);
            return AddressRangeDataset.empty(provider, knownAgents);
        }
    }

    private void write(AddressRangeDataset dataset) {
        Path temp = null;
        try {
            var directory = file.getParent();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), dataset.toDocument());
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("文件系统不支持原子移动，改用普通替换。");
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            logger.error("写入数据集文件 {} 失败。", file, e);
            throw new DatasetPersistenceException("Failed to persist IP data", e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("清理临时文件 {} 失败。", temp, e);
        }
    }
}
