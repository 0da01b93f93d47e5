package club.ppmc.blockip.service;

import static java.util.Map.entry;
import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.blockip.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("RefreshSourceLoader 测试")
class RefreshSourceLoaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("按文件顺序读取提供方下的 agent -> URL")
    void loadsSourcesInOrder() throws IOException {
        var sources = Files.writeString(tempDir.resolve("ai_urls.json"), """
                {"openai": {"gptbot": "https://a.test/gptbot.json", "searchbot": "https://a.test/searchbot.json"}}
                """);

        var loader = new RefreshSourceLoader(objectMapper,
                TestProperties.of(tempDir.resolve("block_ips.json"), "file:" + sources));

        assertThat(loader.sources()).containsExactly(
                entry("gptbot", "https://a.test/gptbot.json"),
                entry("searchbot", "https://a.test/searchbot.json"));
    }

    @Test
    @DisplayName("默认的classpath映射包含三个agent")
    void loadsBundledSources() {
        var loader = new RefreshSourceLoader(objectMapper,
                TestProperties.of(tempDir.resolve("block_ips.json"), "classpath:ai_urls.json"));

        assertThat(loader.sources()).containsOnlyKeys("searchbot", "chatgpt-user", "gptbot");
    }

    @Test
    @DisplayName("文件缺失时得到空映射")
    void missingSourcesYieldEmptyMap() {
        var loader = new RefreshSourceLoader(objectMapper,
                TestProperties.of(tempDir.resolve("block_ips.json"), "file:" + tempDir.resolve("missing.json")));

        assertThat(loader.sources()).isEmpty();
    }
}
