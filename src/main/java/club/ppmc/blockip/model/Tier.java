/**
 * 此文件定义了API订阅等级及其对应的每日请求配额。
 *
 * 关联:
 * - `QuotaLedger`: 根据等级计算每日上限。
 * - `JdbcApiKeyRepository`: 从数据库的`tier`列解析等级。
 */
package club.ppmc.blockip.model;

import java.util.Locale;

public enum Tier {
    FREE(10),
    BASIC(100),
    UNLIMITED(Long.MAX_VALUE);

    private final long dailyLimit;

    Tier(long dailyLimit) {
        this.dailyLimit = dailyLimit;
    }

    public long dailyLimit() {
        return dailyLimit;
    }

    public boolean isUnlimited() {
        return this == UNLIMITED;
    }

    /** 小写名称，用于API响应和数据库存储。 */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 解析数据库或配置中的等级名称（忽略大小写）。
     *
     * @throws IllegalArgumentException 如果名称不是已知等级。
     */
    public static Tier fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Tier code must not be null");
        }
        return Tier.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
