package com.eis.cdc.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings of one circuit editing session.
 *
 * <p>
 * Read from JSON with Jackson; keys that are absent keep their defaults and
 * unknown keys are ignored.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EditorSettings {
    /** Classpath resource consulted by {@link #loadDefault()}. */
    public static final String RESOURCE = "cdc-editor.json";

    /** Decimals of the element tokens emitted while walking the graph. */
    private int tokenDecimals = 12;
    /** Decimals of the extended CDC shown to the user. */
    private int displayDecimals = 4;
    /** Node labels in circuit previews are cut to this many characters; zero keeps them whole. */
    private int labelWidth = 5;
    private String sourceLabel = "WE";
    private String sinkLabel = "CE+RE";
    private String junctionLabel = "Dummy";

    /**
     * Checks the settings and returns them.
     *
     * @throws IllegalArgumentException if a value is out of range.
     */
    public EditorSettings validate() {
        if (tokenDecimals < 1 || tokenDecimals > 17)
            throw new IllegalArgumentException("tokenDecimals must be in [1, 17]: " + tokenDecimals);
        if (displayDecimals < 0 || displayDecimals > 17)
            throw new IllegalArgumentException("displayDecimals must be in [0, 17]: " + displayDecimals);
        if (labelWidth < 0)
            throw new IllegalArgumentException("labelWidth must be >= 0: " + labelWidth);
        requireLabel("sourceLabel", sourceLabel);
        requireLabel("sinkLabel", sinkLabel);
        requireLabel("junctionLabel", junctionLabel);
        return this;
    }

    /** Reads settings from a JSON file. */
    public static EditorSettings load(Path path) throws IOException {
        EditorSettings settings = parse(Files.readString(path));
        log.info("Loaded editor settings from {}", path);
        return settings;
    }

    /** Reads settings from a JSON string. */
    public static EditorSettings parse(String json) {
        try {
            return new ObjectMapper().readValue(json, EditorSettings.class).validate();
        } catch (IOException e) {
            throw new IllegalArgumentException("Malformed editor settings: " + e.getMessage(), e);
        }
    }

    /**
     * Reads {@value #RESOURCE} from the classpath, or returns the built-in
     * defaults when there is none.
     */
    public static EditorSettings loadDefault() {
        try (InputStream in = EditorSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("No {} on the classpath, using defaults", RESOURCE);
                return new EditorSettings();
            }
            EditorSettings settings = new ObjectMapper().readValue(in, EditorSettings.class).validate();
            log.info("Loaded editor settings from classpath {}", RESOURCE);
            return settings;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    private static void requireLabel(String name, String value) {
        if (value == null || value.isBlank())
            throw new IllegalArgumentException(name + " must not be blank");
    }
}
