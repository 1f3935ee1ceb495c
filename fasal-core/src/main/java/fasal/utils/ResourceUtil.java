package fasal.utils;

import cn.hutool.core.io.IORuntimeException;
import cn.hutool.core.io.IoUtil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads bundled data files and prompt templates. Looks on the classpath first, then under
 * the core module's resource folder so tools run from the repository root also find them.
 */
public class ResourceUtil {
    private static final String[] SOURCE_ROOTS = {
            "fasal-core/src/main/resources",
            "../fasal-core/src/main/resources"
    };

    /**
     * @param resPath absolute resource path such as "/data/plant_diseases.json"
     * @return the content, or null if no location has it
     */
    public static String loadAsString(String resPath) {
        if (resPath == null) {
            return null;
        }
        String content = readClasspath(resPath);
        for (int i = 0; content == null && i < SOURCE_ROOTS.length; i++) {
            content = readFile(Paths.get(SOURCE_ROOTS[i] + resPath));
        }
        return content;
    }

    /**
     * Non-blank lines of a resource with '#' comments removed, or null if the resource is missing.
     */
    public static List<String> loadLines(String resPath) {
        String content = loadAsString(resPath);
        if (content == null) {
            return null;
        }
        return Arrays.stream(content.split("\\R"))
                .map(line -> {
                    int hash = line.indexOf('#');
                    return hash >= 0 ? line.substring(0, hash) : line;
                })
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toList());
    }

    public static String loadContentFromFilePath(String filePath) throws IOException {
        return new String(Files.readAllBytes(Paths.get(filePath)), StandardCharsets.UTF_8);
    }

    private static String readClasspath(String resPath) {
        try (InputStream in = ResourceUtil.class.getResourceAsStream(resPath)) {
            if (in == null) {
                return null;
            }
            return IoUtil.read(in, StandardCharsets.UTF_8);
        } catch (IOException | IORuntimeException e) {
            return null;
        }
    }

    private static String readFile(Path path) {
        if (!Files.isRegularFile(path)) {
            return null;
        }
        try {
            return loadContentFromFilePath(path.toString());
        } catch (IOException e) {
            return null;
        }
    }
}
