package org.decide.authentication.shared.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public class CommonPasswordsService {
    private static final Logger LOG = LogManager.getLogger(CommonPasswordsService.class);
    private static final String DEFAULT_RESOURCE = "/common-passwords.txt";

    private final Set<String> commonPasswords;

    public CommonPasswordsService() {
        this(DEFAULT_RESOURCE);
    }

    public CommonPasswordsService(String resourceName) {
        this.commonPasswords = load(resourceName);
        LOG.info("Loaded {} common passwords", commonPasswords.size());
    }

    public boolean isCommonPassword(String password) {
        return commonPasswords.contains(password.strip().toLowerCase(Locale.ROOT));
    }

    private static Set<String> load(String resourceName) {
        InputStream stream = CommonPasswordsService.class.getResourceAsStream(resourceName);
        if (stream == null) {
            throw new IllegalStateException("Common password list not found: " + resourceName);
        }
        try (var reader =
                new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines()
                    .map(String::strip)
                    .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                    .map(line -> line.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
