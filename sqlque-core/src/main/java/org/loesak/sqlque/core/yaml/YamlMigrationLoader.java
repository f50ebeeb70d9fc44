package org.loesak.sqlque.core.yaml;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.loesak.sqlque.core.exception.MigrationConfigurationException;
import org.loesak.sqlque.core.yaml.model.MigrationFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loads YAML migrations from explicitly named classpath resources, e.g.
 * {@code db/migration/V005__CreateNotifications.yml}. The version and description come from the
 * file name; the checksum is taken over the raw bytes.
 */
@Slf4j
public class YamlMigrationLoader {

    private static final String MIGRATION_DEFINITION_FILE_NAME_REGEX = "^V((\\d+\\.?)+)__(\\w+)\\.yml$";
    private static final Pattern MIGRATION_DEFINITION_FILE_NAME_PATTERN = Pattern.compile(MIGRATION_DEFINITION_FILE_NAME_REGEX);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final ClassLoader classLoader;

    public YamlMigrationLoader() {
        this(YamlMigrationLoader.class.getClassLoader());
    }

    public YamlMigrationLoader(@NonNull final ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    public List<YamlMigrationUnit> load(final String... resources) {
        return Arrays.stream(resources).map(this::load).collect(Collectors.toUnmodifiableList());
    }

    public YamlMigrationUnit load(@NonNull final String resource) {
        final String filename = resource.substring(resource.lastIndexOf('/') + 1);

        log.info("Reading contents of migration file [{}]", resource);

        final Matcher matcher = MIGRATION_DEFINITION_FILE_NAME_PATTERN.matcher(filename);
        if (!matcher.matches()) {
            throw new MigrationConfigurationException(String.format(
                    "migration file [%s] does not match the expected pattern V<version>__<Description>.yml",
                    resource));
        }

        final byte[] content = this.read(resource);

        final MigrationFile file;
        try {
            file = YAML_MAPPER.readValue(content, MigrationFile.class);
        } catch (IOException e) {
            throw new MigrationConfigurationException(String.format("failed to parse the contents of migration file [%s]", resource), e);
        }

        if (file == null || file.getUp() == null || file.getUp().getPostgresql() == null || file.getUp().getSqlite() == null) {
            throw new MigrationConfigurationException(String.format(
                    "migration file [%s] must define up statements for both postgresql and sqlite",
                    resource));
        }

        final String version = matcher.group(1);
        final String description = matcher.group(3);

        return new YamlMigrationUnit(
                version,
                file.getName() == null || file.getName().isBlank() ? description : file.getName(),
                resource,
                calculateChecksum(content),
                file);
    }

    private byte[] read(final String resource) {
        try (InputStream stream = this.classLoader.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new MigrationConfigurationException(String.format("could not find migration file [%s] on the classpath", resource));
            }
            return stream.readAllBytes();
        } catch (IOException e) {
            throw new MigrationConfigurationException(String.format("failed to read the contents of migration file [%s]", resource), e);
        }
    }

    private static Integer calculateChecksum(final byte[] content) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("MD5");
            return ByteBuffer.wrap(digest.digest(content)).getInt();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("failed to create message digest", e);
        }
    }
}
