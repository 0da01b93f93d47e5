package club.ppmc.blockip.exception;

import org.springframework.http.HttpStatus;

/** 合并后的数据集无法写入磁盘，此次写入被拒绝，内存快照保持不变。 */
public class DatasetPersistenceException extends BlockIpException {

    public DatasetPersistenceException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "persistence_unavailable", message, cause);
    }
}
