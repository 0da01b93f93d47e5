/**
 * 此服务负责按账户、按UTC日期记录请求数，并决定请求是否放行。
 *
 * 主要职责:
 * - 每个账户每个UTC日最多一条用量记录，在当天首次请求时以计数1创建。
 * - 已达上限的请求被拒绝，且不会增加存储中的计数。
 * - 同一(账户, 日期)的读-改-写在同一把锁内完成，保证并发请求既不会重复创建记录，也不会丢失更新。
 *   锁按键哈希分段，内存占用与账户数量无关。
 * - 持久层出错时放行请求（fail open），记录降级日志并累加降级计数。
 * - 等待分段锁超过`lockWait`时同样降级放行，存储卡住时不会拖住同一分段上的其它账户。
 *
 * 关联:
 * - `UsageRecordRepository`: 用量记录的持久化。
 * - `TieredRateLimiter`: 在每个受保护请求之前调用`checkAndIncrement`。
 * - `UsageController`: 调用`usageSnapshot`生成只读的用量视图。
 */
package club.ppmc.blockip.service;

import club.ppmc.blockip.model.QuotaDecision;
import club.ppmc.blockip.model.Tier;
import club.ppmc.blockip.model.UsageRecord;
import club.ppmc.blockip.model.UsageSnapshot;
import club.ppmc.blockip.repository.UsageRecordRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class QuotaLedger {

    private static final Logger logger = LoggerFactory.getLogger(QuotaLedger.class);
    private static final int LOCK_STRIPES = 64;
    private static final Duration DEFAULT_LOCK_WAIT = Duration.ofSeconds(2);

    private final UsageRecordRepository usageRecordRepository;
    private final Clock clock;
    private final Duration lockWait;
    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
    private final AtomicLong degradedAdmissions = new AtomicLong();

    @Autowired
    public QuotaLedger(UsageRecordRepository usageRecordRepository, Clock clock) {
        this(usageRecordRepository, clock, DEFAULT_LOCK_WAIT);
    }

    public QuotaLedger(UsageRecordRepository usageRecordRepository, Clock clock, Duration lockWait) {
        this.usageRecordRepository = usageRecordRepository;
        this.clock = clock;
        this.lockWait = lockWait;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    /**
     * 检查并占用一次配额。
     *
     * @param accountId 账户ID。
     * @param tier      账户等级。
     * @return 放行/拒绝决策，`resetAt`总是调用时刻之后的下一个UTC午夜。
     */
    public QuotaDecision checkAndIncrement(String accountId, Tier tier) {
        var today = today();
        var resetAt = nextUtcMidnight(today);
        var lock = lockFor(accountId, today);

        if (!acquire(lock)) {
            var total = degradedAdmissions.incrementAndGet();
            logger.warn("等待账户 '{}' 的用量锁超时 ({} ms)，请求以降级模式放行 (累计降级放行 {} 次)。",
                    accountId, lockWait.toMillis(), total);
            return QuotaDecision.failOpen(resetAt);
        }
        try {
            var existing = usageRecordRepository.find(accountId, today);
            if (existing.isEmpty()) {
                usageRecordRepository.insert(new UsageRecord(accountId, today, 1));
                logger.debug("账户 '{}' 今日首次请求，已创建用量记录。", accountId);
                return QuotaDecision.admitted(1, resetAt);
            }

            var count = existing.get().count();
            if (!tier.isUnlimited() && count + 1 > tier.dailyLimit()) {
                logger.warn("配额已用尽: 账户 '{}', 等级 {}, 今日请求次数 {}, 限制 {}",
                        accountId, tier.code(), count, tier.dailyLimit());
                return QuotaDecision.denied(count, resetAt);
            }

            var updated = count + 1;
            if (usageRecordRepository.updateCount(accountId, today, updated) == 0) {
                // 记录在读取后被外部清理
                usageRecordRepository.insert(new UsageRecord(accountId, today, updated));
            }
            logger.debug("请求允许: 账户 '{}', 今日请求次数 {}", accountId, updated);
            return QuotaDecision.admitted(updated, resetAt);
        } catch (DataAccessException e) {
            var total = degradedAdmissions.incrementAndGet();
            logger.warn("用量存储不可用，账户 '{}' 的请求以降级模式放行 (累计降级放行 {} 次)。", accountId, total, e);
            return QuotaDecision.failOpen(resetAt);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 读取当日用量，不修改任何状态。
     *
     * @throws DataAccessException 用量存储不可用时。
     */
    public UsageSnapshot usageSnapshot(String accountId, Tier tier) {
        var today = today();
        var used = usageRecordRepository.find(accountId, today)
                .map(UsageRecord::count)
                .orElse(0L);
        var remaining = tier.isUnlimited()
                ? OptionalLong.empty()
                : OptionalLong.of(Math.max(0, tier.dailyLimit() - used));
        return new UsageSnapshot(tier, used, remaining, nextUtcMidnight(today));
    }

    /** 自启动以来因存储不可用而被放行的请求数。 */
    public long degradedAdmissions() {
        return degradedAdmissions.get();
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static Instant nextUtcMidnight(LocalDate today) {
        return today.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private boolean acquire(ReentrantLock lock) {
        try {
            return lock.tryLock(lockWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ReentrantLock lockFor(String accountId, LocalDate date) {
        return locks[Math.floorMod(Objects.hash(accountId, date), LOCK_STRIPES)];
    }
}
