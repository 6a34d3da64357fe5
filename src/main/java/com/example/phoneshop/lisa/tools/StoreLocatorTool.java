package com.example.phoneshop.lisa.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Looks up branch addresses by city. The store file is read on every call so that edits are
 * picked up without a restart.
 */
@Slf4j
public class StoreLocatorTool {

    public static final String NAME = "store_locator";
    static final String FILE_MISSING = "Lỗi: Không tìm thấy file dữ liệu cửa hàng.";
    static final String FILE_CORRUPT = "Lỗi: File dữ liệu cửa hàng bị hỏng.";

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;

    public StoreLocatorTool(ResourceLoader resourceLoader, ObjectMapper objectMapper, String location) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = location;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Store(String city, String address) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StoreFile(List<Store> stores) {
    }

    public ToolDefinition definition() {
        return new ToolDefinition(
                NAME,
                "Finds the addresses of store branches in a city in Vietnam, for example \"Hà Nội\" or \"Hồ Chí Minh\".",
                ToolDefinition.objectSchema(Map.of("city", Map.of("type", "string"))),
                this::run);
    }

    Mono<Object> run(JsonNode input) {
        String city = input == null ? "" : input.path("city").asText("");
        return Mono.<Object>fromCallable(() -> find(city))
                .subscribeOn(Schedulers.boundedElastic());
    }

    String find(String city) {
        StoreFile file;
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("store file not found: {}", location);
            return FILE_MISSING;
        }
        try (InputStream in = resource.getInputStream()) {
            file = objectMapper.readValue(in, StoreFile.class);
        } catch (JsonProcessingException e) {
            log.warn("store file unreadable: {}", e.getOriginalMessage());
            return FILE_CORRUPT;
        } catch (IOException e) {
            log.warn("store file not readable: {}", e.toString());
            return FILE_MISSING;
        }
        if (file == null) {
            log.warn("store file is empty: {}", location);
            return FILE_CORRUPT;
        }

        String needle = city == null ? "" : city.strip().toLowerCase(Locale.ROOT);
        List<Store> found = file.stores() == null ? List.of() : file.stores().stream()
                .filter(s -> s.city() != null && s.city().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
        if (needle.isEmpty() || found.isEmpty()) {
            return "Rất tiếc, không tìm thấy cửa hàng nào ở '" + city + "'.";
        }
        StringBuilder sb = new StringBuilder("Tìm thấy " + found.size() + " cửa hàng ở " + city + ":\n");
        for (Store s : found) {
            sb.append("- ").append(s.address()).append('\n');
        }
        return sb.toString();
    }
}
