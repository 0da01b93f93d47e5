package club.ppmc.blockip.exception;

import org.springframework.http.HttpStatus;

public class RefreshInProgressException extends BlockIpException {

    public RefreshInProgressException() {
        super(HttpStatus.CONFLICT, "refresh_in_progress", "An IP data update is already running");
    }
}
