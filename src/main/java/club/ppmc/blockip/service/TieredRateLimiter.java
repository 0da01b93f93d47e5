/**
 * 此服务在受保护的操作执行之前进行分级配额检查。
 *
 * 主要职责:
 * - 调用`QuotaLedger`占用一次配额；放行时不做任何改变。
 * - 拒绝时生成`429`判定，消息中包含距离重置的可读倒计时。
 * - `execute`包装一个受保护的操作：放行时原样返回其结果，拒绝时抛出`QuotaExceededException`且不调用该操作。
 * - 不校验凭证，账户和等级由拦截器链的前一阶段提供。
 *
 * 关联:
 * - `TieredRateLimitInterceptor`: 拦截器链的第二阶段，调用`check`。
 * - `GlobalExceptionHandler`: 将`QuotaExceededException`转换为`429`。
 */
package club.ppmc.blockip.service;

import club.ppmc.blockip.exception.QuotaExceededException;
import club.ppmc.blockip.model.AccountContext;
import club.ppmc.blockip.model.RateLimitDecision;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TieredRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(TieredRateLimiter.class);

    private final QuotaLedger quotaLedger;
    private final Clock clock;

    public TieredRateLimiter(QuotaLedger quotaLedger, Clock clock) {
        this.quotaLedger = quotaLedger;
        this.clock = clock;
    }

    public RateLimitDecision check(AccountContext account) {
        var decision = quotaLedger.checkAndIncrement(account.accountId(), account.tier());
        var resetInSeconds = Math.max(0, Duration.between(clock.instant(), decision.resetAt()).getSeconds());

        if (decision.degraded()) {
            logger.warn("账户 '{}' 的配额检查处于降级模式，请求已放行。", account.accountId());
        }
        if (decision.admitted()) {
            return RateLimitDecision.admit(decision.resetAt(), resetInSeconds);
        }

        var message = "Rate limit exceeded. Try again in " + formatResetCountdown(resetInSeconds) + ".";
        return RateLimitDecision.deny(message, decision.resetAt(), resetInSeconds);
    }

    /**
     * 占用一次配额后执行`operation`。
     *
     * @throws QuotaExceededException 配额已用尽，此时`operation`不会被调用。
     */
    public <T> T execute(AccountContext account, Supplier<T> operation) {
        var decision = check(account);
        if (!decision.admitted()) {
            throw new QuotaExceededException(decision.message(), decision.resetAt(), decision.resetInSeconds());
        }
        return operation.get();
    }

    /**
     * 将剩余秒数格式化为倒计时文本。
     * 不少于1小时: "H hours, M minutes"；不少于1分钟: "M minutes, S seconds"；否则: "S seconds"。
     */
    public static String formatResetCountdown(long seconds) {
        var hours = seconds / 3600;
        var minutes = (seconds % 3600) / 60;
        var secs = seconds % 60;
        if (hours > 0) {
            return hours + " hours, " + minutes + " minutes";
        }
        if (minutes > 0) {
            return minutes + " minutes, " + secs + " seconds";
        }
        return secs + " seconds";
    }
}
