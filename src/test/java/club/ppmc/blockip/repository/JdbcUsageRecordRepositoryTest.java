package club.ppmc.blockip.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import club.ppmc.blockip.model.Tier;
import club.ppmc.blockip.model.UsageRecord;
import club.ppmc.blockip.service.QuotaLedger;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.JdbcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 多线程写入需要各自提交，因此关闭测试事务，改为每个测试前清表。
 */
@JdbcTest
@Import({JdbcUsageRecordRepository.class, JdbcApiKeyRepository.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DisplayName("JDBC 存储测试")
class JdbcUsageRecordRepositoryTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 17);

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private JdbcUsageRecordRepository usageRecordRepository;

    @Autowired
    private JdbcApiKeyRepository apiKeyRepository;

    @BeforeEach
    void cleanTables() {
        jdbcTemplate.update("DELETE FROM usage_records");
        jdbcTemplate.update("DELETE FROM api_keys");
    }

    @Test
    @DisplayName("按(账户, 日期)插入、读取和更新")
    void insertFindUpdate() {
        usageRecordRepository.insert(new UsageRecord("acct-1", TODAY, 1));

        assertThat(usageRecordRepository.find("acct-1", TODAY)).contains(new UsageRecord("acct-1", TODAY, 1));
        assertThat(usageRecordRepository.find("acct-1", TODAY.plusDays(1))).isEmpty();

        assertThat(usageRecordRepository.updateCount("acct-1", TODAY, 7)).isEqualTo(1);
        assertThat(usageRecordRepository.find("acct-1", TODAY)).map(UsageRecord::count).contains(7L);
        assertThat(usageRecordRepository.updateCount("acct-2", TODAY, 7)).isZero();
    }

    @Test
    @DisplayName("同一(账户, 日期)只能有一条记录")
    void rejectsDuplicateRecord() {
        usageRecordRepository.insert(new UsageRecord("acct-1", TODAY, 1));

        assertThatThrownBy(() -> usageRecordRepository.insert(new UsageRecord("acct-1", TODAY, 1)))
                .isInstanceOf(DuplicateKeyException.class);
    }

    @Test
    @DisplayName("凭证按精确匹配查找并解析等级")
    void findsApiKeys() {
        jdbcTemplate.update("INSERT INTO api_keys (api_key, account_id, tier, active) VALUES (?, ?, ?, ?)",
                "key-basic-0001", "acct-1", "basic", true);

        assertThat(apiKeyRepository.findByApiKey("key-basic-0001"))
                .singleElement()
                .satisfies(record -> {
                    assertThat(record.accountId()).isEqualTo("acct-1");
                    assertThat(record.tier()).isEqualTo(Tier.BASIC);
                    assertThat(record.active()).isTrue();
                });
        assertThat(apiKeyRepository.findByApiKey("KEY-BASIC-0001")).isEmpty();
    }

    @Test
    @DisplayName("QuotaLedger 在真实数据库上并发计数无丢失")
    void ledgerCountsExactlyUnderConcurrency() throws Exception {
        var ledger = new QuotaLedger(usageRecordRepository,
                Clock.fixed(Instant.parse("2026-10-17T12:00:00Z"), ZoneOffset.UTC));
        var threads = 8;
        var callsPerThread = 20;
        var executor = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var futures = new ArrayList<Future<Integer>>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    int admitted = 0;
                    for (int i = 0; i < callsPerThread; i++) {
                        if (ledger.checkAndIncrement("acct-1", Tier.BASIC).admitted()) {
                            admitted++;
                        }
                    }
                    return admitted;
                }));
            }
            start.countDown();

            int admitted = 0;
            for (var future : futures) {
                admitted += future.get(30, TimeUnit.SECONDS);
            }

            assertThat(admitted).isEqualTo(100);
            assertThat(ledger.degradedAdmissions()).isZero();
            assertThat(usageRecordRepository.find("acct-1", TODAY)).map(UsageRecord::count).contains(100L);
        } finally {
            executor.shutdownNow();
        }
    }
}
