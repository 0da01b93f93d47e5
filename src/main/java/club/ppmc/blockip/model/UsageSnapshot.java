/**
 * 账户当日用量的只读快照。
 *
 * `remaining`为空表示无上限（unlimited等级）。
 */
package club.ppmc.blockip.model;

import java.time.Instant;
import java.util.OptionalLong;

public record UsageSnapshot(Tier tier, long used, OptionalLong remaining, Instant resetAt) {}
