package com.largomodo.monitorlayout.util;

import com.largomodo.monitorlayout.core.domain.MonitorRecord;
import com.largomodo.monitorlayout.core.domain.Orientation;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a client monitor topology from a text file.
 * <p>
 * One monitor per line:
 * <pre>
 * # x,y,width,height[,primary][,key=value...]
 * 0,0,1920,1080,primary,phys=530x300,scale=150
 * 1920,0,1280,1024,orient=90
 * </pre>
 * Keys: {@code phys=WxH} (millimetres), {@code orient=0|90|180|270},
 * {@code scale=<percent>} (desktop scale), {@code device=<percent>}.
 * Text after {@code #} is ignored, as are blank lines. Unset scales default to 100%.
 * <p>
 * Pure function with no state. Safe for concurrent use.
 */
public class TopologyFileReader {

    private static final int DEFAULT_SCALE = 100;

    private TopologyFileReader() {
        // Static utility class - prevent instantiation
    }

    /**
     * Parse every monitor in a topology file, in file order.
     *
     * @param file topology file (UTF-8)
     * @return monitors in the order they appear; empty if the file has none
     * @throws IOException if the file cannot be read or a line is malformed (message names file and line)
     */
    public static List<MonitorRecord> read(Path file) throws IOException {
        List<MonitorRecord> monitors = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                try {
                    MonitorRecord monitor = parseLine(line);
                    if (monitor != null) {
                        monitors.add(monitor);
                    }
                } catch (IllegalArgumentException e) {
                    throw new IOException(file + ":" + lineNumber + ": " + e.getMessage(), e);
                }
            }
        }
        return monitors;
    }

    /**
     * Parse one line.
     *
     * @return the monitor, or null for a blank or comment-only line
     * @throws IllegalArgumentException if the line is malformed
     */
    public static MonitorRecord parseLine(String line) {
        int comment = line.indexOf('#');
        String content = (comment >= 0 ? line.substring(0, comment) : line).trim();
        if (content.isEmpty()) {
            return null;
        }

        String[] fields = content.split(",");
        if (fields.length < 4) {
            throw new IllegalArgumentException("Expected x,y,width,height but got: " + content);
        }
        int x = parseInt("x", fields[0]);
        int y = parseInt("y", fields[1]);
        int width = parseInt("width", fields[2]);
        int height = parseInt("height", fields[3]);

        boolean primary = false;
        int physicalWidth = 0;
        int physicalHeight = 0;
        Orientation orientation = Orientation.LANDSCAPE;
        int desktopScale = DEFAULT_SCALE;
        int deviceScale = DEFAULT_SCALE;

        for (int i = 4; i < fields.length; i++) {
            String field = fields[i].trim();
            if (field.equalsIgnoreCase("primary")) {
                primary = true;
                continue;
            }
            int eq = field.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Unknown attribute: " + field);
            }
            String key = field.substring(0, eq).trim().toLowerCase();
            String value = field.substring(eq + 1).trim();
            switch (key) {
                case "phys":
                    String[] dims = value.toLowerCase().split("x");
                    if (dims.length != 2) {
                        throw new IllegalArgumentException("Expected phys=WxH but got: " + field);
                    }
                    physicalWidth = parseInt("physical width", dims[0]);
                    physicalHeight = parseInt("physical height", dims[1]);
                    break;
                case "orient":
                    orientation = Orientation.fromDegrees(parseInt("orientation", value));
                    break;
                case "scale":
                    desktopScale = parseInt("desktop scale", value);
                    break;
                case "device":
                    deviceScale = parseInt("device scale", value);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown attribute: " + key);
            }
        }

        return new MonitorRecord(x, y, width, height, primary, physicalWidth, physicalHeight,
                orientation, desktopScale, deviceScale);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + ": '" + value.trim() + "'", e);
        }
    }
}
