/**
 * 基于`JdbcTemplate`的用量记录存储，表结构见`schema.sql`中的`usage_records`。
 */
package club.ppmc.blockip.repository;

import club.ppmc.blockip.model.UsageRecord;
import java.sql.Date;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcUsageRecordRepository implements UsageRecordRepository {

    private static final String SELECT =
            "SELECT account_id, usage_date, request_count FROM usage_records WHERE account_id = ? AND usage_date = ?";
    private static final String INSERT =
            "INSERT INTO usage_records (account_id, usage_date, request_count) VALUES (?, ?, ?)";
    private static final String UPDATE =
            "UPDATE usage_records SET request_count = ? WHERE account_id = ? AND usage_date = ?";

    private static final RowMapper<UsageRecord> ROW_MAPPER = (rs, rowNum) -> new UsageRecord(
            rs.getString("account_id"),
            rs.getDate("usage_date").toLocalDate(),
            rs.getLong("request_count"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcUsageRecordRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<UsageRecord> find(String accountId, LocalDate date) {
        return jdbcTemplate.query(SELECT, ROW_MAPPER, accountId, Date.valueOf(date)).stream().findFirst();
    }

    @Override
    public void insert(UsageRecord record) {
        jdbcTemplate.update(INSERT, record.accountId(), Date.valueOf(record.date()), record.count());
    }

    @Override
    public int updateCount(String accountId, LocalDate date, long count) {
        return jdbcTemplate.update(UPDATE, count, accountId, Date.valueOf(date));
    }
}
