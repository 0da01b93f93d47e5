/**
 * 凭证存储的查询契约。实现只需按凭证字符串精确匹配，不做缓存。
 */
package club.ppmc.blockip.repository;

import club.ppmc.blockip.model.ApiKeyRecord;
import java.util.List;

public interface ApiKeyRepository {

    /**
     * 按凭证字符串精确查找。
     *
     * @param apiKey 调用方提供的凭证。
     * @return 匹配的记录，通常最多一条；没有匹配时返回空列表。
     * @throws org.springframework.dao.DataAccessException 存储不可用时。
     */
    List<ApiKeyRecord> findByApiKey(String apiKey);
}
