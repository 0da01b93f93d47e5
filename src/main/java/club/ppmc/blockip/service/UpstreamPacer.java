package club.ppmc.blockip.service;

import java.time.Duration;

/**
 * 控制相邻两次上游请求之间的暂停。生产实现真实休眠，测试中可以替换为记录调用的实现。
 */
@FunctionalInterface
public interface UpstreamPacer {

    void pause(Duration duration) throws InterruptedException;

    static UpstreamPacer sleeping() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
