package im.arun.htmldiff.config;

import im.arun.htmldiff.diff.Granularity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void classpathDefaultsMatchBuiltInDefaults() {
        HtmlDiffConfig config = new ConfigLoader().load(null);

        assertThat(config).isEqualTo(new HtmlDiffConfig());
        assertThat(config.getGranularity()).isEqualTo(Granularity.WORD);
        assertThat(config.isContainerFallback()).isTrue();
        assertThat(config.isSessionLog()).isFalse();
    }

    @Test
    void explicitFileOverridesClasspath() throws Exception {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, "granularity: character\ncontainerFallback: false\nlogDirectory: /tmp/diff-logs\n");

        HtmlDiffConfig config = new ConfigLoader(file.toString()).getDefaultConfig();

        assertThat(config.getGranularity()).isEqualTo(Granularity.CHARACTER);
        assertThat(config.isContainerFallback()).isFalse();
        assertThat(config.isDocumentTextFallback()).isTrue();
        assertThat(config.getLogDirectory()).isEqualTo("/tmp/diff-logs");
    }

    @Test
    void missingFileFallsBackToDefaults() {
        HtmlDiffConfig config = new ConfigLoader(tempDir.resolve("absent.yaml").toString()).getDefaultConfig();

        assertThat(config).isEqualTo(new HtmlDiffConfig());
    }

    @Test
    void unreadableFileFallsBackToDefaults() throws Exception {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "granularity: [not, a, value\n");

        assertThat(new ConfigLoader(file.toString()).getDefaultConfig()).isEqualTo(new HtmlDiffConfig());
    }

    @Test
    void userOptionsAreMergedIntoACopy() {
        ConfigLoader loader = new ConfigLoader();
        Map<String, Object> options = new HashMap<>();
        options.put("granularity", "line");
        options.put("container_fallback", "no");
        options.put("sessionLog", "yes");
        options.put("indent_output", false);
        options.put("log_directory", "out/logs");

        HtmlDiffConfig config = loader.load(options);

        assertThat(config.getGranularity()).isEqualTo(Granularity.LINE);
        assertThat(config.isContainerFallback()).isFalse();
        assertThat(config.isSessionLog()).isTrue();
        assertThat(config.isIndentOutput()).isFalse();
        assertThat(config.getLogDirectory()).isEqualTo("out/logs");
        assertThat(loader.getDefaultConfig()).isEqualTo(new HtmlDiffConfig());
    }

    @Test
    void unknownKeysAndBadValuesAreIgnored() {
        Map<String, Object> options = new HashMap<>();
        options.put("granularity", "sentence");
        options.put("colour", "blue");

        HtmlDiffConfig config = new ConfigLoader().load(options);

        assertThat(config).isEqualTo(new HtmlDiffConfig());
    }
}
