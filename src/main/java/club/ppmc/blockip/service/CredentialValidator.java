/**
 * 此服务负责将调用方提供的凭证解析为账户上下文。
 *
 * 主要职责:
 * - 空凭证 -> 原因`missing`；不存在或已停用 -> 原因`invalid_or_inactive`。
 * - 每次都查询存储，不做缓存，以便及时感知凭证被吊销。
 *
 * 关联:
 * - `ApiKeyRepository`: 凭证的后端存储。
 * - `ApiKeyAuthInterceptor`: 拦截器链的第一阶段，调用本服务。
 */
package club.ppmc.blockip.service;

import club.ppmc.blockip.exception.CredentialInvalidException;
import club.ppmc.blockip.model.AccountContext;
import club.ppmc.blockip.repository.ApiKeyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CredentialValidator {

    private static final Logger logger = LoggerFactory.getLogger(CredentialValidator.class);

    private final ApiKeyRepository apiKeyRepository;

    public CredentialValidator(ApiKeyRepository apiKeyRepository) {
        this.apiKeyRepository = apiKeyRepository;
    }

    /**
     * 校验凭证。
     *
     * @param apiKey 请求头中的凭证，可能为`null`。
     * @return 凭证对应的账户和等级。
     * @throws CredentialInvalidException 凭证缺失、不存在或已停用。
     */
    public AccountContext validate(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw CredentialInvalidException.missing();
        }

        var matches = apiKeyRepository.findByApiKey(apiKey);
        if (matches.isEmpty()) {
            logger.warn("未找到凭证 '{}'。", maskApiKey(apiKey));
            throw CredentialInvalidException.invalidOrInactive();
        }
        if (matches.size() > 1) {
            logger.warn("凭证 '{}' 匹配到 {} 条记录，使用第一条。", maskApiKey(apiKey), matches.size());
        }

        var record = matches.get(0);
        if (!record.active()) {
            logger.warn("凭证 '{}' (账户 '{}') 已停用。", maskApiKey(apiKey), record.accountId());
            throw CredentialInvalidException.invalidOrInactive();
        }
        return new AccountContext(record.accountId(), record.tier());
    }

    /**
     * 对凭证进行脱敏处理，用于日志输出。
     */
    static String maskApiKey(String apiKey) {
        if (apiKey == null || apiKey.length() < 8) {
            return "****";
        }
        return apiKey.substring(0, 4) + "****" + apiKey.substring(apiKey.length() - 4);
    }
}
