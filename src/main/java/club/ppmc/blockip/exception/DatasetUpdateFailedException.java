/**
 * 一次刷新中没有任何agent拿到有效数据。消息中拼接了所有告警，持久化的数据集保持不变。
 */
package club.ppmc.blockip.exception;

import java.util.List;
import org.springframework.http.HttpStatus;

public class DatasetUpdateFailedException extends BlockIpException {

    private final List<String> warnings;

    public DatasetUpdateFailedException(List<String> warnings) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "dataset_update_failed", buildMessage(warnings));
        this.warnings = List.copyOf(warnings);
    }

    public List<String> getWarnings() {
        return warnings;
    }

    private static String buildMessage(List<String> warnings) {
        var message = "Failed to retrieve any valid IP data. ";
        if (!warnings.isEmpty()) {
            message += "\n\nErrors encountered: " + String.join("; ", warnings);
        }
        return message;
    }
}
