/**
 * 凭证校验通过后得到的调用方上下文。
 *
 * 由`ApiKeyAuthInterceptor`放入请求属性，后续的`TieredRateLimitInterceptor`和Controller从中读取，
 * 限流阶段不会再次校验凭证。
 */
package club.ppmc.blockip.model;

public record AccountContext(String accountId, Tier tier) {

    public static final String REQUEST_ATTRIBUTE = "club.ppmc.blockip.accountContext";
}
