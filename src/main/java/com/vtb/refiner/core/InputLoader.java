package com.vtb.refiner.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.refiner.models.Control;
import com.vtb.refiner.suppression.LegacyControlFlags;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Чтение входных файлов (JSON или YAML по расширению).
 *
 * Угрозы: массив или объект с полем threats. Компоненты: массив, объект с полем components
 * или DFD документ (external_entities, processes, assets, data_flows). Контроли: массив,
 * объект с полем controls или старый формат булевых флагов.
 */
@Slf4j
public class InputLoader {

    private final ObjectMapper jsonMapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public List<RawThreatRecord> loadThreats(Path path) throws IOException {
        JsonNode root = read(path);
        JsonNode items = root.isArray() ? root : root.path("threats");
        if (!items.isArray()) {
            throw new IOException("В файле " + path + " нет списка угроз");
        }
        List<RawThreatRecord> threats = jsonMapper.convertValue(items, new TypeReference<List<RawThreatRecord>>() {});
        log.info("Загружено {} угроз из {}", threats.size(), path);
        return threats;
    }

    public List<RawComponentRecord> loadComponents(Path path) throws IOException {
        JsonNode root = read(path);
        List<RawComponentRecord> components;
        if (root.isArray()) {
            components = jsonMapper.convertValue(root, new TypeReference<List<RawComponentRecord>>() {});
        } else if (root.path("components").isArray()) {
            components = jsonMapper.convertValue(root.path("components"),
                new TypeReference<List<RawComponentRecord>>() {});
        } else if (isDfdDocument(root)) {
            components = fromDfd(root);
        } else {
            throw new IOException("Не удалось распознать формат инвентаря компонентов в " + path);
        }
        log.info("Загружено {} компонентов из {}", components.size(), path);
        return components;
    }

    public List<RawControlRecord> loadControls(Path path) throws IOException {
        JsonNode root = read(path);
        List<RawControlRecord> controls;
        if (root.isArray()) {
            controls = jsonMapper.convertValue(root, new TypeReference<List<RawControlRecord>>() {});
        } else if (root.path("controls").isArray()) {
            controls = jsonMapper.convertValue(root.path("controls"), new TypeReference<List<RawControlRecord>>() {});
        } else if (root.isObject()) {
            Map<String, Object> flags = jsonMapper.convertValue(root, new TypeReference<Map<String, Object>>() {});
            if (!LegacyControlFlags.isLegacyFormat(flags)) {
                throw new IOException("Не удалось распознать формат контролей в " + path);
            }
            log.info("Файл {} в старом формате флагов контролей", path);
            controls = new ArrayList<>();
            for (Control control : LegacyControlFlags.toControls(flags)) {
                controls.add(RawControlRecord.from(control));
            }
        } else {
            throw new IOException("Не удалось распознать формат контролей в " + path);
        }
        log.info("Загружено {} контролей из {}", controls.size(), path);
        return controls;
    }

    private JsonNode read(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IOException("Файл не найден: " + path);
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".yaml") || name.endsWith(".yml") ? yamlMapper : jsonMapper;
        JsonNode root = mapper.readTree(path.toFile());
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IOException("Пустой файл: " + path);
        }
        return root;
    }

    private static boolean isDfdDocument(JsonNode root) {
        return root.has("external_entities") || root.has("processes") || root.has("assets") || root.has("data_flows");
    }

    /**
     * DFD документ в инвентарь: сущности, процессы, хранилища и потоки "source to destination"
     */
    private static List<RawComponentRecord> fromDfd(JsonNode root) {
        List<RawComponentRecord> components = new ArrayList<>();
        addNamed(components, root.path("external_entities"), "EXTERNAL_ENTITY");
        addNamed(components, root.path("processes"), "PROCESS");
        addNamed(components, root.path("assets"), "DATA_STORE");
        for (JsonNode flow : root.path("data_flows")) {
            String source = flow.path("source").asText("");
            String destination = flow.path("destination").asText("");
            if (source.isBlank() || destination.isBlank()) {
                continue;
            }
            components.add(RawComponentRecord.builder()
                .canonicalName(source + " to " + destination)
                .type("DATA_FLOW")
                .description(flow.path("data_description").asText(null))
                .dataClassification(flow.path("data_classification").asText(null))
                .build());
        }
        return components;
    }

    private static void addNamed(List<RawComponentRecord> components, JsonNode items, String type) {
        for (JsonNode item : items) {
            String name = item.isTextual() ? item.asText() : item.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            components.add(RawComponentRecord.builder()
                .canonicalName(name)
                .type(type)
                .description(item.isObject() ? item.path("description").asText(null) : null)
                .dataClassification(item.isObject() ? item.path("data_classification").asText(null) : null)
                .build());
        }
    }
}
