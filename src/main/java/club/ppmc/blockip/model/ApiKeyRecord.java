/**
 * `api_keys`表中的一行凭证记录。
 */
package club.ppmc.blockip.model;

public record ApiKeyRecord(String apiKey, String accountId, Tier tier, boolean active) {}
