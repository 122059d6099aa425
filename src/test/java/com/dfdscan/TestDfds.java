package com.dfdscan;

import com.dfdscan.core.DfdParser;
import com.dfdscan.models.Dataflow;
import com.dfdscan.models.DfdElement;
import com.dfdscan.models.DfdModel;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Тестовые DFD: фикстуры из src/test/resources/dfd и сборка диаграмм в коде
 */
public final class TestDfds {

    private TestDfds() {}

    public static Path path(String name) {
        URL url = TestDfds.class.getResource("/dfd/" + name);
        if (url == null) {
            throw new IllegalArgumentException("Фикстура не найдена: " + name);
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static DfdModel load(String name) {
        return new DfdParser().parseFromFile(path(name));
    }

    public static DfdElement element(String id, String type, String trustLevel) {
        return DfdElement.builder()
            .id(id)
            .name(id.toUpperCase())
            .type(type)
            .trustLevel(trustLevel)
            .description("element " + id)
            .build();
    }

    public static Dataflow flow(String id, String from, String to) {
        return Dataflow.builder()
            .id(id)
            .name("flow " + id)
            .from(from)
            .to(to)
            .build();
    }

    public static DfdModel dfd(List<DfdElement> elements, List<Dataflow> dataflows) {
        return DfdModel.builder()
            .id("dfd-test")
            .name("Test DFD")
            .elements(new ArrayList<>(elements))
            .dataflows(new ArrayList<>(dataflows))
            .build();
    }
}
