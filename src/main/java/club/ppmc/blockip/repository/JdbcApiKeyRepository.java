package club.ppmc.blockip.repository;

import club.ppmc.blockip.model.ApiKeyRecord;
import club.ppmc.blockip.model.Tier;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcApiKeyRepository implements ApiKeyRepository {

    private static final String SELECT_BY_KEY =
            "SELECT api_key, account_id, tier, active FROM api_keys WHERE api_key = ? ORDER BY id";

    private static final RowMapper<ApiKeyRecord> ROW_MAPPER = (rs, rowNum) -> new ApiKeyRecord(
            rs.getString("api_key"),
            rs.getString("account_id"),
            Tier.fromCode(rs.getString("tier")),
            rs.getBoolean("active"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcApiKeyRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<ApiKeyRecord> findByApiKey(String apiKey) {
        return jdbcTemplate.query(SELECT_BY_KEY, ROW_MAPPER, apiKey);
    }
}
