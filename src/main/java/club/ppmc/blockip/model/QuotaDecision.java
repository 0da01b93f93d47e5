/**
 * `QuotaLedger.checkAndIncrement`的结果。
 *
 * @param admitted 是否放行本次请求。
 * @param used     决策后当日已计数的请求数（降级模式下为-1，表示未知）。
 * @param resetAt  下一个UTC午夜。
 * @param degraded 持久层不可用时为`true`，此时请求被无条件放行（fail open）。
 */
package club.ppmc.blockip.model;

import java.time.Instant;

public record QuotaDecision(boolean admitted, long used, Instant resetAt, boolean degraded) {

    public static QuotaDecision admitted(long used, Instant resetAt) {
        return new QuotaDecision(true, used, resetAt, false);
    }

    public static QuotaDecision denied(long used, Instant resetAt) {
        return new QuotaDecision(false, used, resetAt, false);
    }

    public static QuotaDecision failOpen(Instant resetAt) {
        return new QuotaDecision(true, -1, resetAt, true);
    }
}
