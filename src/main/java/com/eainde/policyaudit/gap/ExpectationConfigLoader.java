package com.eainde.policyaudit.gap;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the YAML expectation mapping from a file or from the classpath.
 * Parse failures surface as {@link InvalidExpectationConfigException}.
 */
@Slf4j
public class ExpectationConfigLoader {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private final ObjectMapper yamlMapper;

    public ExpectationConfigLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * @param location a file path, or {@code classpath:expectations.yaml}
     */
    public ExpectationConfig load(String location) {
        if (location == null || location.isBlank()) {
            throw new InvalidExpectationConfigException("No expectation mapping location configured");
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length()).replaceFirst("^/", "");
            try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
                if (in == null) {
                    throw new InvalidExpectationConfigException("Expectation mapping not found on classpath: " + resource);
                }
                return read(in, location);
            } catch (IOException e) {
                throw new InvalidExpectationConfigException("Cannot read expectation mapping " + location, e);
            }
        }
        return load(Path.of(location));
    }

    public ExpectationConfig load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new InvalidExpectationConfigException("Expectation mapping not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        } catch (IOException e) {
            throw new InvalidExpectationConfigException("Cannot read expectation mapping " + path, e);
        }
    }

    private ExpectationConfig read(InputStream in, String source) throws IOException {
        ExpectationConfig config = yamlMapper.readValue(in, ExpectationConfig.class);
        if (config == null) {
            throw new InvalidExpectationConfigException("Expectation mapping " + source + " is empty");
        }
        log.info("Loaded expectation mapping from {} ({} conditions)", source,
                config.conditions() == null ? 0 : config.conditions().size());
        return config;
    }
}
