package club.ppmc.blockip.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import club.ppmc.blockip.exception.DatasetUpdateFailedException;
import club.ppmc.blockip.exception.RefreshInProgressException;
import club.ppmc.blockip.model.AddressRangeDataset;
import club.ppmc.blockip.model.RefreshReport;
import club.ppmc.blockip.service.DatasetRefresher;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * HTTP接口测试：凭证校验 -> 配额检查 -> Controller 的完整拦截器链。
 * 数据集来自`fixtures/block_ips.json`，刷新器被替换为Mock，不访问上游。
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Block IP API 集成测试")
class BlockIpApiIntegrationTest {

    private static final String API_KEY_HEADER = "X-API-Key";
    private static final String UPDATE_HEADER = "X-Update-Secret";
    private static final String FREE_KEY = "free-key-0001";
    private static final String BASIC_KEY = "basic-key-0001";
    private static final String UNLIMITED_KEY = "unlimited-key-0001";
    private static final String INACTIVE_KEY = "inactive-key-0001";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private DatasetRefresher datasetRefresher;

    @BeforeEach
    void setUp() {
        jdbcTemplate.update("DELETE FROM usage_records");
        jdbcTemplate.update("DELETE FROM api_keys");
        insertKey(FREE_KEY, "acct-free", "free", true);
        insertKey(BASIC_KEY, "acct-basic", "basic", true);
        insertKey(UNLIMITED_KEY, "acct-unlimited", "unlimited", true);
        insertKey(INACTIVE_KEY, "acct-inactive", "basic", false);
    }

    private void insertKey(String apiKey, String accountId, String tier, boolean active) {
        jdbcTemplate.update("INSERT INTO api_keys (api_key, account_id, tier, active) VALUES (?, ?, ?, ?)",
                apiKey, accountId, tier, active);
    }

    @Test
    @DisplayName("/health 无需凭证")
    void healthIsUnauthenticated() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    @DisplayName("缺少凭证 -> 403 missing")
    void missingApiKeyIsForbidden() throws Exception {
        mockMvc.perform(get("/block-ips"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("missing"));
    }

    @Test
    @DisplayName("未知或已停用的凭证 -> 403 invalid_or_inactive")
    void invalidApiKeyIsForbidden() throws Exception {
        mockMvc.perform(get("/block-ips").header(API_KEY_HEADER, "no-such-key"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("invalid_or_inactive"));
        mockMvc.perform(get("/block-ips").header(API_KEY_HEADER, INACTIVE_KEY))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("invalid_or_inactive"));
    }

    @Test
    @DisplayName("GET /block-ips 返回完整数据集")
    void returnsFullDataset() throws Exception {
        mockMvc.perform(get("/block-ips").header(API_KEY_HEADER, BASIC_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.openai.searchbot", hasSize(2)))
                .andExpect(jsonPath("$.openai['chatgpt-user'][0]").value("23.98.142.176/28"))
                .andExpect(jsonPath("$.openai.gptbot", hasSize(0)));
    }

    @Test
    @DisplayName("GET /block-ips/{agent}: 空列表为200，未知agent为404")
    void returnsSingleAgent() throws Exception {
        mockMvc.perform(get("/block-ips/gptbot").header(API_KEY_HEADER, BASIC_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.gptbot", hasSize(0)));
        mockMvc.perform(get("/block-ips/unknownbot").header(API_KEY_HEADER, BASIC_KEY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.reason").value("agent_not_found"));
    }

    @Test
    @DisplayName("free 等级第11次请求 -> 429，带倒计时和 Retry-After")
    void freeTierIsLimitedToTenRequests() throws Exception {
        for (int i = 0; i < 10; i++) {
            mockMvc.perform(get("/block-ips").header(API_KEY_HEADER, FREE_KEY))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(get("/block-ips").header(API_KEY_HEADER, FREE_KEY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.reason").value("quota_exceeded"))
                .andExpect(jsonPath("$.message", startsWith("Rate limit exceeded. Try again in ")))
                .andExpect(jsonPath("$.reset_in_seconds").isNumber())
                .andExpect(jsonPath("$.reset_time", containsString("T00:00:00Z")));
    }

    @Test
    @DisplayName("/usage 本身计入配额")
    void usageCountsTowardQuota() throws Exception {
        mockMvc.perform(get("/block-ips").header(API_KEY_HEADER, BASIC_KEY))
                .andExpect(status().isOk());

        mockMvc.perform(get("/usage").header(API_KEY_HEADER, BASIC_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("basic"))
                .andExpect(jsonPath("$.used_requests").value(2))
                .andExpect(jsonPath("$.remaining_requests").value(98))
                .andExpect(jsonPath("$.reset_in_seconds").isNumber())
                .andExpect(jsonPath("$.reset_time", containsString("T00:00:00Z")));
    }

    @Test
    @DisplayName("unlimited 等级的剩余量为 unlimited")
    void unlimitedTierUsage() throws Exception {
        mockMvc.perform(get("/api-usage").header(API_KEY_HEADER, UNLIMITED_KEY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tier").value("unlimited"))
                .andExpect(jsonPath("$.used_requests").value(1))
                .andExpect(jsonPath("$.remaining_requests").value("unlimited"));
    }

    @Test
    @DisplayName("/update-ips 需要更新密钥，API凭证无效")
    void updateRequiresSecret() throws Exception {
        mockMvc.perform(get("/update-ips").header(API_KEY_HEADER, UNLIMITED_KEY))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/update-ips").header(UPDATE_HEADER, "wrong"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.reason").value("invalid_update_secret"));
    }

    @Test
    @DisplayName("/update-ips 部分成功 -> 200，带告警")
    void updateReportsPartialSuccess() throws Exception {
        var dataset = new AddressRangeDataset("openai", Map.of("gptbot", List.of("52.230.152.0/24")));
        given(datasetRefresher.refresh()).willReturn(new RefreshReport(
                dataset, List.of("gptbot"), List.of("gptbot"), List.of("HTTP error occurred for searchbot: 500")));

        mockMvc.perform(get("/update-ips").header(UPDATE_HEADER, "test-update-secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("IP data update completed with partial success"))
                .andExpect(jsonPath("$.data.gptbot[0]").value("52.230.152.0/24"))
                .andExpect(jsonPath("$.warnings[0]").value("HTTP error occurred for searchbot: 500"));
    }

    @Test
    @DisplayName("/update-ips 全部成功时不返回 warnings 字段")
    void updateOmitsEmptyWarnings() throws Exception {
        var dataset = new AddressRangeDataset("openai", Map.of("gptbot", List.of("52.230.152.0/24")));
        given(datasetRefresher.refresh()).willReturn(
                new RefreshReport(dataset, List.of("gptbot"), List.of("gptbot"), List.of()));

        mockMvc.perform(get("/update-ips").header(UPDATE_HEADER, "test-update-secret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.warnings").doesNotExist());
    }

    @Test
    @DisplayName("/update-ips 全部失败 -> 503，刷新进行中 -> 409")
    void updateFailures() throws Exception {
        given(datasetRefresher.refresh())
                .willThrow(new DatasetUpdateFailedException(List.of("No IP data found for gptbot")))
                .willThrow(new RefreshInProgressException());

        mockMvc.perform(get("/update-ips").header(UPDATE_HEADER, "test-update-secret"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.reason").value("dataset_update_failed"))
                .andExpect(jsonPath("$.message", containsString("Errors encountered: No IP data found for gptbot")));
        mockMvc.perform(get("/update-ips").header(UPDATE_HEADER, "test-update-secret"))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("/monitor/status 返回各agent的IP段数量")
    void monitorStatus() throws Exception {
        mockMvc.perform(get("/monitor/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.agent_range_counts.searchbot").value(2))
                .andExpect(jsonPath("$.degraded_quota_admissions").value(0));
    }
}
