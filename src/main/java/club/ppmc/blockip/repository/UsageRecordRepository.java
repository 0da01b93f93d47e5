/**
 * 此文件定义了每日用量记录的持久化契约。
 *
 * 主要职责:
 * - 按(账户, UTC日期)读取、插入和更新一条用量记录。
 * - 不负责并发控制：读-改-写的互斥由`QuotaLedger`保证，存储层的主键约束只作为最后一道防线。
 *
 * 所有方法在存储不可用时抛出`org.springframework.dao.DataAccessException`。
 */
package club.ppmc.blockip.repository;

import club.ppmc.blockip.model.UsageRecord;
import java.time.LocalDate;
import java.util.Optional;

public interface UsageRecordRepository {

    Optional<UsageRecord> find(String accountId, LocalDate date);

    /**
     * 插入一条新记录。
     *
     * @throws org.springframework.dao.DuplicateKeyException 记录已存在时。
     */
    void insert(UsageRecord record);

    /**
     * 将已有记录的计数更新为给定值。
     *
     * @return 受影响的行数，记录不存在时为0。
     */
    int updateCount(String accountId, LocalDate date, long count);
}
