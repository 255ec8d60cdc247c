package com.crypto.connector.common.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.env.PropertySourceLoader;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MutablePropertySources;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Layers YAML from {@code app.config.dir} ahead of the packaged defaults: {@code base.yml},
 * then {@code endpoints/*.yml}, then {@code connections/*.yml}. Earlier files win.
 */
@Slf4j
public class ConfigDirectoryEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {
    static final String CONFIG_DIR_PROP = "app.config.dir";
    private static final String PACKAGED_CONFIG_PREFIX = "Config resource";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        String configDir = environment.getProperty(CONFIG_DIR_PROP);
        if (configDir == null || configDir.isBlank()) {
            return;
        }
        Path root = Path.of(configDir);
        if (!Files.isDirectory(root)) {
            LOG.debug("Config directory not found: {}", root.toAbsolutePath());
            return;
        }
        MutablePropertySources sources = environment.getPropertySources();
        String anchor = packagedConfigSource(sources);
        for (PropertySource<?> source : load(root)) {
            if (anchor == null) {
                sources.addLast(source);
            } else {
                sources.addBefore(anchor, source);
            }
        }
    }

    private static String packagedConfigSource(MutablePropertySources sources) {
        for (PropertySource<?> source : sources) {
            if (source.getName().startsWith(PACKAGED_CONFIG_PREFIX)) {
                return source.getName();
            }
        }
        return null;
    }

    List<PropertySource<?>> load(Path root) {
        PropertySourceLoader loader = new YamlPropertySourceLoader();
        List<PropertySource<?>> out = new ArrayList<>();
        loadIfExists(loader, out, root.resolve("base.yml"));
        loadIfExists(loader, out, root.resolve("base.yaml"));
        loadAllFromDir(loader, out, root.resolve("endpoints"));
        loadAllFromDir(loader, out, root.resolve("connections"));
        return out;
    }

    private void loadAllFromDir(PropertySourceLoader loader, List<PropertySource<?>> out, Path dir) {
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> stream = Files.list(dir)) {
            List<Path> files = stream
                    .filter(path -> Files.isRegularFile(path) && isYaml(path))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString().toLowerCase()))
                    .toList();
            for (Path file : files) {
                loadIfExists(loader, out, file);
            }
        } catch (IOException e) {
            LOG.warn("Failed to list config directory: {}", dir.toAbsolutePath());
        }
    }

    private void loadIfExists(PropertySourceLoader loader, List<PropertySource<?>> out, Path path) {
        if (!Files.isRegularFile(path)) {
            return;
        }
        Resource resource = new FileSystemResource(path);
        try {
            out.addAll(loader.load(path.toString(), resource));
            LOG.info("Loaded config: {}", path.toAbsolutePath());
        } catch (IOException e) {
            LOG.warn("Failed to load config file: {}", path.toAbsolutePath());
        }
    }

    private boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase();
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }
}
