package com.ryuqq.wsclient.adapter.wsdl;

import com.ryuqq.wsclient.core.config.HttpSettings;
import com.ryuqq.wsclient.core.exception.ContractLoadException;
import com.ryuqq.wsclient.core.spi.DocumentLoader;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 로컬 WSDL 로더.
 *
 * <p>지원 형식: 인라인 XML({@code <}로 시작), 파일 경로, {@code file:} URI, {@code classpath:} 리소스.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LocalDocumentLoader implements DocumentLoader {

    static final String CLASSPATH_PREFIX = "classpath:";

    @Override
    public String load(String location, HttpSettings http) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("location cannot be null or blank");
        }
        String trimmed = location.trim();
        if (trimmed.startsWith("<")) {
            return trimmed;
        }
        if (trimmed.startsWith(CLASSPATH_PREFIX)) {
            return readClasspath(trimmed.substring(CLASSPATH_PREFIX.length()));
        }
        Path path;
        try {
            path = trimmed.startsWith("file:") ? Path.of(URI.create(trimmed)) : Path.of(trimmed);
        } catch (IllegalArgumentException e) {
            throw new ContractLoadException("Invalid WSDL location: " + location, e);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ContractLoadException("Unable to read WSDL document: " + path, e);
        }
    }

    private static String readClasspath(String resource) {
        String name = resource.startsWith("/") ? resource.substring(1) : resource;
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = LocalDocumentLoader.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(name)) {
            if (in == null) {
                throw new ContractLoadException("WSDL resource not found on classpath: " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ContractLoadException("Unable to read WSDL resource: " + name, e);
        }
    }
}
