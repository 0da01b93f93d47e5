/**
 * `/usage`接口的响应体。unlimited等级的`remaining_requests`为字符串"unlimited"。
 */
package club.ppmc.blockip.dto;

import club.ppmc.blockip.model.UsageSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;

public record UsageResponse(
        String tier,
        @JsonProperty("used_requests") long usedRequests,
        @JsonProperty("remaining_requests") Object remainingRequests,
        @JsonProperty("reset_in_seconds") long resetInSeconds,
        @JsonProperty("reset_time") String resetTime) {

    public static final String UNLIMITED = "unlimited";

    public static UsageResponse from(UsageSnapshot snapshot, Instant now) {
        Object remaining = snapshot.remaining().isPresent()
                ? (Object) snapshot.remaining().getAsLong()
                : UNLIMITED;
        var resetIn = Math.max(0, Duration.between(now, snapshot.resetAt()).getSeconds());
        return new UsageResponse(
                snapshot.tier().code(),
                snapshot.used(),
                remaining,
                resetIn,
                snapshot.resetAt().toString());
    }
}
