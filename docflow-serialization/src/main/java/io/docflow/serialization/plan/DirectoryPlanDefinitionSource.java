package io.docflow.serialization.plan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.docflow.core.exception.PlanLoadException;
import io.docflow.core.plan.PlanDefinition;
import io.docflow.core.plan.PlanDefinitionSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Reads plan definitions from a release directory.
///
/// ```
/// <root>/
///   _active/active_releases.json          {"workflows": {"<id>": "<version>"}}
///   workflows/<id>/releases/<version>/definition.json
///   <loose plan>.json
/// ```
///
/// Only the release named by the active index is read for each workflow. Loose
/// `*.json` files directly under the root are read as well, in file name order.
/// A workflow named in the index without its definition file fails the whole read.
///
/// @implNote Reads the file system on every {@link #readAll()} call.
public class DirectoryPlanDefinitionSource implements PlanDefinitionSource {

    private static final Logger logger =
            Logger.getLogger(DirectoryPlanDefinitionSource.class.getName());

    static final String ACTIVE_INDEX = "_active/active_releases.json";

    private final Path root;
    private final ObjectMapper objectMapper;
    private final PlanDefinitionReader reader;

    public DirectoryPlanDefinitionSource(Path root) {
        this(root, new ObjectMapper());
    }

    public DirectoryPlanDefinitionSource(Path root, ObjectMapper objectMapper) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.reader = new PlanDefinitionReader(objectMapper);
    }

    @Override
    public List<PlanDefinition> readAll() throws PlanLoadException {
        if (!Files.isDirectory(root)) {
            throw new PlanLoadException(root.toString(), "Plan directory does not exist", null);
        }
        List<PlanDefinition> definitions = new ArrayList<>();
        for (Map.Entry<String, String> release : activeReleases().entrySet()) {
            Path definition =
                    root.resolve("workflows")
                            .resolve(release.getKey())
                            .resolve("releases")
                            .resolve(release.getValue())
                            .resolve("definition.json");
            if (!Files.isRegularFile(definition)) {
                throw new PlanLoadException(
                        definition.toString(),
                        "Active release "
                                + release.getKey()
                                + "@"
                                + release.getValue()
                                + " has no definition.json",
                        null);
            }
            definitions.add(reader.read(definition));
        }
        for (Path loose : looseDefinitions()) {
            definitions.add(reader.read(loose));
        }
        logger.info("Read " + definitions.size() + " plan definitions from " + root);
        return definitions;
    }

    private Map<String, String> activeReleases() throws PlanLoadException {
        Path index = root.resolve(ACTIVE_INDEX);
        Map<String, String> releases = new LinkedHashMap<>();
        if (!Files.isRegularFile(index)) {
            return releases;
        }
        try {
            JsonNode workflows = objectMapper.readTree(index.toFile()).path("workflows");
            Iterator<Map.Entry<String, JsonNode>> fields = workflows.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                releases.put(field.getKey(), field.getValue().asText());
            }
            return releases;
        } catch (IOException e) {
            throw new PlanLoadException(
                    index.toString(), "Invalid active release index: " + e.getMessage(), e);
        }
    }

    private List<Path> looseDefinitions() throws PlanLoadException {
        try (Stream<Path> files = Files.list(root)) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PlanLoadException(root.toString(), "Cannot list plan directory", e);
        }
    }
}
