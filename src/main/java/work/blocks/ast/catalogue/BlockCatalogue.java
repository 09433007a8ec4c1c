package work.blocks.ast.catalogue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.blocks.ast.node.ArgKind;
import work.blocks.ast.node.InstructionCategory;

/**
 * Known block names, read from a JSON-lines file with one definition per line:
 * <pre>
 * {"name": "sum", "kind": "function", "arity": 2}
 * {"name": "repeat", "kind": "clamp", "arity": 1}
 * {"name": "break", "kind": "flow-no-args"}
 * </pre>
 * Instruction kinds are stored under their base category, so {@code flow-no-args} is recorded as {@code flow}.
 * Blank lines are skipped; unreadable lines are kept as {@link #warnings()}.
 */
public final class BlockCatalogue {
    private static final Logger log = LoggerFactory.getLogger(BlockCatalogue.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final Map<String, BlockDefinition> definitions;
    private final List<String> warnings;

    private BlockCatalogue(Map<String, BlockDefinition> definitions, List<String> warnings) {
        this.definitions = Collections.unmodifiableMap(definitions);
        this.warnings = List.copyOf(warnings);
    }

    public static BlockCatalogue of(List<BlockDefinition> entries) {
        var definitions = new LinkedHashMap<String, BlockDefinition>();
        var warnings = new ArrayList<String>();
        for (var entry : entries) {
            add(definitions, warnings, normalize(entry.name(), entry.kind(), entry.arity(), warnings, "entry " + entry.name()));
        }
        return new BlockCatalogue(definitions, warnings);
    }

    public static BlockCatalogue load(Path path) {
        try (var reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            var catalogue = read(reader, path.toString());
            log.debug("Loaded {} block definitions from {}", catalogue.size(), path);
            return catalogue;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read block catalogue: " + path, ex);
        }
    }

    public static BlockCatalogue parse(String jsonl) {
        try {
            return read(new StringReader(jsonl == null ? "" : jsonl), "<inline>");
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read inline block catalogue", ex);
        }
    }

    private static BlockCatalogue read(Reader source, String origin) throws IOException {
        var definitions = new LinkedHashMap<String, BlockDefinition>();
        var warnings = new ArrayList<String>();
        var reader = new BufferedReader(source);
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo += 1;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String where = origin + ":" + lineNo;
            Map<String, Object> raw;
            try {
                raw = JSON.readValue(trimmed, MAP_REF);
            } catch (IOException ex) {
                warnings.add("invalid catalogue entry at " + where + ": " + ex.getMessage());
                continue;
            }
            if (raw == null) {
                warnings.add("catalogue entry at " + where + " is not an object");
                continue;
            }
            String name = raw.get("name") instanceof String n && !n.isBlank() ? n.trim() : null;
            String kind = raw.get("kind") instanceof String k && !k.isBlank() ? k : null;
            if (name == null || kind == null) {
                warnings.add("catalogue entry at " + where + " is missing \"name\" or \"kind\"");
                continue;
            }
            Integer arity = null;
            Object rawArity = raw.get("arity");
            if (rawArity != null) {
                arity = toArity(rawArity);
            }
            if (rawArity != null && arity == null) {
                warnings.add("catalogue entry \"" + name + "\" at " + where + " has invalid arity " + rawArity);
                continue;
            }
            add(definitions, warnings, normalize(name, kind, arity, warnings, where));
        }
        warnings.forEach(log::warn);
        return new BlockCatalogue(definitions, warnings);
    }

    private static Integer toArity(Object raw) {
        long value;
        if (raw instanceof Integer || raw instanceof Long) {
            value = ((Number) raw).longValue();
        } else if (raw instanceof BigInteger big && big.bitLength() < 32) {
            value = big.longValue();
        } else {
            return null;
        }
        return value >= 0 && value <= Integer.MAX_VALUE ? (int) value : null;
    }

    private static BlockDefinition normalize(String name, String kind, Integer arity, List<String> warnings, String where) {
        String tag = kind.trim().toLowerCase(Locale.ROOT);
        for (ArgKind argKind : ArgKind.values()) {
            if (argKind.tag().equals(tag)) {
                return new BlockDefinition(name, tag, arity);
            }
        }
        for (InstructionCategory category : InstructionCategory.values()) {
            if (category.tag().equals(tag)) {
                return new BlockDefinition(name, category.base().tag(), arity);
            }
        }
        warnings.add("catalogue entry \"" + name + "\" at " + where + " has unsupported kind \"" + kind + "\"");
        return null;
    }

    private static void add(Map<String, BlockDefinition> definitions, List<String> warnings, BlockDefinition definition) {
        if (definition == null) {
            return;
        }
        if (definitions.put(definition.name(), definition) != null) {
            warnings.add("catalogue entry \"" + definition.name() + "\" is defined more than once; the last one wins");
        }
    }

    public Optional<BlockDefinition> find(String name) {
        return Optional.ofNullable(name == null ? null : definitions.get(name));
    }

    public Map<String, BlockDefinition> definitions() {
        return definitions;
    }

    public List<String> warnings() {
        return warnings;
    }

    public int size() {
        return definitions.size();
    }
}
