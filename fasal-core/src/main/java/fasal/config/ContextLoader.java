package fasal.config;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import fasal.config.pojo.GlobalConfigurations;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads fasal.yml once per process and keeps it in {@link #configuration}.
 */
@Slf4j
public class ContextLoader {
    public static final String CONFIG_FILE = "fasal.yml";
    public static final String CONFIG_PATH_PROPERTY = "fasal.config";
    public static final String ADVICE_API_KEY_ENV = "FASAL_ADVICE_API_KEY";

    public static volatile GlobalConfigurations configuration;

    private static final ObjectMapper MAPPER = YAMLMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS, true)
            .build();

    public static void loadContext() {
        if (configuration != null) {
            return;
        }
        synchronized (ContextLoader.class) {
            if (configuration != null) {
                return;
            }
            String explicitPath = System.getProperty(CONFIG_PATH_PROPERTY);
            GlobalConfigurations loaded = null;
            try {
                if (StrUtil.isNotBlank(explicitPath)) {
                    loaded = load(Paths.get(explicitPath));
                } else {
                    loaded = loadFromClasspath("/" + CONFIG_FILE);
                }
            } catch (IOException e) {
                log.error("Failed to read {}, falling back to defaults", CONFIG_FILE, e);
            }
            if (loaded == null) {
                log.warn("{} not found, using default configuration", CONFIG_FILE);
                loaded = new GlobalConfigurations();
            }
            configuration = applyEnvironment(loaded);
        }
    }

    public static GlobalConfigurations load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            log.info("Loading configuration from {}", path.toAbsolutePath());
            return MAPPER.readValue(in, GlobalConfigurations.class);
        }
    }

    public static GlobalConfigurations loadFromClasspath(String resPath) throws IOException {
        try (InputStream in = ContextLoader.class.getResourceAsStream(resPath)) {
            if (in == null) {
                return null;
            }
            log.info("Loading configuration from classpath {}", resPath);
            return MAPPER.readValue(in, GlobalConfigurations.class);
        }
    }

    private static GlobalConfigurations applyEnvironment(GlobalConfigurations config) {
        String apiKey = System.getenv(ADVICE_API_KEY_ENV);
        if (StrUtil.isBlank(config.getAdvice().getApiKey()) && StrUtil.isNotBlank(apiKey)) {
            config.getAdvice().setApiKey(apiKey);
        }
        return config;
    }
}
