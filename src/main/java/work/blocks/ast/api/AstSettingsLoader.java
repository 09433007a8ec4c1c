package work.blocks.ast.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Reads {@link AstSettings} from a TOML manifest:
 * <pre>
 * [diagnostics]
 * level = "warn"
 *
 * [catalogue]
 * path = "blocks.jsonl"
 *
 * [registry]
 * shared = false
 * </pre>
 */
public final class AstSettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(AstSettingsLoader.class);

    private AstSettingsLoader() {}

    /**
     * Loads the manifest at {@code path}; a missing file yields {@link AstSettings#defaults()}.
     */
    public static AstSettings load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.debug("No settings manifest at {}, using defaults", path);
            return AstSettings.defaults();
        }
        try {
            TomlParseResult result = Toml.parse(Files.readString(path));
            return fromToml(result, path.toAbsolutePath().getParent());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read settings: " + path, ex);
        }
    }

    /**
     * @param baseDirectory directory a relative catalogue path resolves against; may be {@code null}
     */
    public static AstSettings fromToml(TomlParseResult result, Path baseDirectory) {
        if (result == null) {
            return AstSettings.defaults();
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid settings manifest: " + errors);
        }
        var builder = AstSettings.builder();

        TomlTable diagnostics = table(result, "diagnostics");
        if (diagnostics != null) {
            builder.diagnosticLevel(DiagnosticLevel.from(string(diagnostics, "diagnostics", "level")));
        }

        TomlTable catalogue = table(result, "catalogue");
        if (catalogue != null) {
            String raw = string(catalogue, "catalogue", "path");
            if (raw != null && !raw.isBlank()) {
                Path cataloguePath = Path.of(raw.trim());
                if (!cataloguePath.isAbsolute() && baseDirectory != null) {
                    cataloguePath = baseDirectory.resolve(cataloguePath).normalize();
                }
                builder.catalogue(cataloguePath);
            }
        }

        TomlTable registry = table(result, "registry");
        if (registry != null) {
            builder.useSharedRegistry(Boolean.TRUE.equals(bool(registry, "registry", "shared")));
        }

        var settings = builder.build();
        log.debug("Loaded settings {}", settings);
        return settings;
    }

    private static TomlTable table(TomlParseResult result, String key) {
        if (!result.contains(key)) {
            return null;
        }
        if (!result.isTable(key)) {
            throw new IllegalArgumentException("Invalid settings manifest: [" + key + "] must be a table");
        }
        return result.getTable(key);
    }

    private static String string(TomlTable table, String section, String key) {
        if (!table.contains(key)) {
            return null;
        }
        if (!table.isString(key)) {
            throw new IllegalArgumentException("Invalid settings manifest: " + section + "." + key + " must be a string");
        }
        return table.getString(key);
    }

    private static Boolean bool(TomlTable table, String section, String key) {
        if (!table.contains(key)) {
            return null;
        }
        if (!table.isBoolean(key)) {
            throw new IllegalArgumentException("Invalid settings manifest: " + section + "." + key + " must be a boolean");
        }
        return table.getBoolean(key);
    }
}
