/**
 * 此文件定义了账户每日用量的数据记录。
 *
 * 每个账户每个UTC日期最多一条记录，在当天首次请求时创建，被允许的请求使计数加一。
 *
 * 关联:
 * - `UsageRecordRepository`: 读写此记录。
 * - `QuotaLedger`: 在单写者区段内对计数进行读-改-写。
 */
package club.ppmc.blockip.model;

import java.time.LocalDate;

public record UsageRecord(String accountId, LocalDate date, long count) {

    public UsageRecord {
        if (count < 0) {
            throw new IllegalArgumentException("Usage count must not be negative: " + count);
        }
    }
}
