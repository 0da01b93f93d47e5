/**
 * `GET /usage` (别名`/api-usage`)：返回调用方当日的配额使用情况。
 * 本次请求已在配额拦截器中计数，因此`used_requests`包含本次请求。
 */
package club.ppmc.blockip.controller;

import club.ppmc.blockip.dto.UsageResponse;
import club.ppmc.blockip.model.AccountContext;
import club.ppmc.blockip.service.QuotaLedger;
import java.time.Clock;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class UsageController {

    private final QuotaLedger quotaLedger;
    private final Clock clock;

    public UsageController(QuotaLedger quotaLedger, Clock clock) {
        this.quotaLedger = quotaLedger;
        this.clock = clock;
    }

    @GetMapping({"/usage", "/api-usage"})
    public UsageResponse getUsage(@RequestAttribute(AccountContext.REQUEST_ATTRIBUTE) AccountContext account) {
        var snapshot = quotaLedger.usageSnapshot(account.accountId(), account.tier());
        return UsageResponse.from(snapshot, clock.instant());
    }
}
