/**
 * `/update-ips`成功（含部分成功）时的响应体。没有告警时省略`warnings`字段。
 */
package club.ppmc.blockip.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateResponse(String message, Map<String, List<String>> data, List<String> warnings) {}
