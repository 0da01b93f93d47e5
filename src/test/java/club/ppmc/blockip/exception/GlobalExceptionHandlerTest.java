package club.ppmc.blockip.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

@DisplayName("GlobalExceptionHandler 测试")
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    @DisplayName("配额拒绝 -> 429，带 Retry-After 和重置时间")
    void handlesQuotaExceeded() {
        var resetAt = Instant.parse("2026-10-18T00:00:00Z");
        var ex = new QuotaExceededException("Rate limit exceeded. Try again in 2 hours, 0 minutes.", resetAt, 7200);

        var response = handler.handleQuotaExceededException(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("7200");
        var body = response.getBody();
        assertThat(body).isNotNull();
        assertThat(body.code()).isEqualTo(429);
        assertThat(body.reason()).isEqualTo("quota_exceeded");
        assertThat(body.message()).isEqualTo("Rate limit exceeded. Try again in 2 hours, 0 minutes.");
        assertThat(body.resetInSeconds()).isEqualTo(7200L);
        assertThat(body.resetTime()).isEqualTo("2026-10-18T00:00:00Z");
    }

    @Test
    @DisplayName("业务异常使用自带的状态码和原因码")
    void handlesBlockIpException() {
        var response = handler.handleBlockIpException(
                new DatasetUpdateFailedException(List.of("No IP data found for gptbot")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().reason()).isEqualTo("dataset_update_failed");
        assertThat(response.getBody().resetTime()).isNull();
    }

    @Test
    @DisplayName("持久层异常 -> 503")
    void handlesDataAccessException() {
        var response = handler.handleDataAccessException(new DataAccessResourceFailureException("db down"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().reason()).isEqualTo("persistence_unavailable");
    }

    @Test
    @DisplayName("未预期的异常 -> 500，不暴露细节")
    void handlesUnexpectedException() {
        var response = handler.handleException(new IllegalStateException("secret detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().message()).doesNotContain("secret detail");
    }
}
