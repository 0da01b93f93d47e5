/**
 * 凭证缺失、不存在或已停用。
 *
 * 原因码为`missing`或`invalid_or_inactive`，由`ApiKeyAuthInterceptor`写入403响应。
 */
package club.ppmc.blockip.exception;

import org.springframework.http.HttpStatus;

public class CredentialInvalidException extends BlockIpException {

    public static final String MISSING = "missing";
    public static final String INVALID_OR_INACTIVE = "invalid_or_inactive";

    public CredentialInvalidException(String reason, String message) {
        super(HttpStatus.FORBIDDEN, reason, message);
    }

    public static CredentialInvalidException missing() {
        return new CredentialInvalidException(MISSING, "API key is missing");
    }

    public static CredentialInvalidException invalidOrInactive() {
        return new CredentialInvalidException(INVALID_OR_INACTIVE, "Invalid or inactive API key");
    }
}
