/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Kitbash Viewer.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.kitbash.portal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line argument parser for the portal.
 * <p>
 * Flags override the loaded {@link PortalConfiguration}; options that are not given leave the configured value in
 * place.
 *
 * @author hal.hildebrand
 */
public class KitbashCommandLine {
    private static final Logger log = LoggerFactory.getLogger(KitbashCommandLine.class);

    /**
     * What the process was asked to do.
     */
    public enum Action {
        RUN, HELP, HELP_KEYS, HELP_SETTINGS, VERSION
    }

    /**
     * Holder for everything given on the command line.
     */
    public static class Config {
        public Action action = Action.RUN;

        public String       configFile;
        public String       host;
        public Integer      port;
        public String       sceneDir;
        public List<String> extensions;
        public Long         debounceMillis;
        public Integer      queueCapacity;
        public boolean      openBrowser;
        public boolean      digestContent;
        public boolean      exitOnQuit;

        public final List<String> errors = new ArrayList<>();

        public Path configPath() {
            return configFile == null ? null : Path.of(configFile);
        }

        /**
         * Overlay the given flags onto a loaded configuration.
         */
        public PortalConfiguration applyTo(PortalConfiguration base) {
            var result = base;
            if (host != null) {
                result = result.withHost(host);
            }
            if (port != null) {
                result = result.withPort(port);
            }
            if (sceneDir != null) {
                result = result.withSceneDir(sceneDir);
            }
            if (extensions != null) {
                result = result.withExtensions(extensions);
            }
            if (debounceMillis != null) {
                result = result.withDebounceMillis(debounceMillis);
            }
            if (queueCapacity != null) {
                result = result.withQueueCapacity(queueCapacity);
            }
            if (openBrowser) {
                result = result.withOpenBrowser(true);
            }
            if (digestContent) {
                result = result.withDigestContent(true);
            }
            if (exitOnQuit) {
                result = result.withExitOnQuit(true);
            }
            return result;
        }

        @Override
        public String toString() {
            return String.format("Config{action=%s, config=%s, host=%s, port=%s, sceneDir=%s}", action, configFile,
                                 host, port, sceneDir);
        }
    }

    /**
     * Parse command-line arguments.
     */
    public static Config parse(String[] args) {
        var config = new Config();

        for (int i = 0; i < args.length; i++) {
            var arg = args[i];

            switch (arg) {
                case "-p", "--port" -> {
                    var value = value(args, ++i, arg, config);
                    if (value != null) {
                        config.port = parseInt(value, "port", config);
                    }
                }
                case "--host" -> config.host = value(args, ++i, arg, config);
                case "-s", "--scene-dir" -> config.sceneDir = value(args, ++i, arg, config);
                case "--config" -> config.configFile = value(args, ++i, arg, config);
                case "--ext" -> {
                    var value = value(args, ++i, arg, config);
                    if (value != null) {
                        config.extensions = Arrays.stream(value.split(","))
                                                  .map(String::trim)
                                                  .filter(s -> !s.isEmpty())
                                                  .toList();
                    }
                }
                case "--debounce-ms" -> {
                    var value = value(args, ++i, arg, config);
                    if (value != null) {
                        var millis = parseInt(value, "debounce", config);
                        config.debounceMillis = millis == null ? null : millis.longValue();
                    }
                }
                case "--queue-capacity" -> {
                    var value = value(args, ++i, arg, config);
                    if (value != null) {
                        config.queueCapacity = parseInt(value, "queue capacity", config);
                    }
                }
                case "-o", "--open" -> config.openBrowser = true;
                case "--digest" -> config.digestContent = true;
                case "--exit-on-quit" -> config.exitOnQuit = true;
                case "--help-keys" -> config.action = Action.HELP_KEYS;
                case "--help-settings" -> config.action = Action.HELP_SETTINGS;
                case "-h", "--help" -> config.action = Action.HELP;
                case "-V", "--version" -> config.action = Action.VERSION;
                default -> log.warn("Unknown option: {}", arg);
            }
        }

        return config;
    }

    private static String value(String[] args, int index, String option, Config config) {
        if (index < args.length) {
            return args[index];
        }
        config.errors.add(option + " requires a value");
        return null;
    }

    private static Integer parseInt(String value, String what, Config config) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            config.errors.add("Invalid " + what + ": " + value);
            return null;
        }
    }

    /**
     * Print usage information.
     */
    public static void printUsage(PrintStream out) {
        out.println("Kitbash Viewer Portal - live mesh directory sync");
        out.println();
        out.println("Usage: kitbash-portal [options]");
        out.println();
        printOptions(out);
        out.println();
        out.println("Examples:");
        out.println("  kitbash-portal -s ./scene -o");
        out.println("  kitbash-portal --port 9000 --ext .obj,.stl --debounce-ms 250");
    }

    /**
     * Print the keyboard controls of the viewer.
     */
    public static void printKeyboardHelp(PrintStream out) {
        out.println("Kitbash Viewer - Keyboard Controls");
        out.println();
        out.println("Navigation:");
        out.println("  Mouse drag       Rotate camera");
        out.println("  Mouse wheel      Zoom in/out");
        out.println("  0                Reset camera to initial position");
        out.println("  1-6              Standard view angles (front/back/right/left/top/bottom)");
        out.println();
        out.println("Selection:");
        out.println("  Click object     Select object");
        out.println("  Click empty      Deselect");
        out.println("  [                Select previous object");
        out.println("  ]                Select next object");
        out.println();
        out.println("View:");
        out.println("  f                Frame selected object");
        out.println("  F (Shift+f)      Frame all visible objects");
        out.println("  Tab              Toggle file list overlay");
        out.println("  g                Toggle grid visibility");
        out.println("  w                Cycle wireframe mode (solid/solid+wire/wire)");
        out.println();
        out.println("Object Management:");
        out.println("  h                Hide/show selected object");
        out.println("  H (Shift+h)      Show all hidden objects");
        out.println("  r                Reload all files");
    }

    /**
     * Print the available settings.
     */
    public static void printSettingsHelp(PrintStream out) {
        out.println("Kitbash Viewer - Available Settings");
        out.println();
        printOptions(out);
        out.println();
        out.println("Configuration file keys (JSON, see " + PortalConfiguration.DEFAULTS_RESOURCE + "):");
        out.println("  host, port, sceneDir, extensions, debounceMillis, queueCapacity,");
        out.println("  digestContent, openBrowser, exitOnQuit");
    }

    private static void printOptions(PrintStream out) {
        out.println("Basic Options:");
        out.println("  -p, --port <PORT>         Server port (default: 8080)");
        out.println("      --host <HOST>         Bind address (default: 127.0.0.1)");
        out.println("  -s, --scene-dir <PATH>    Directory to watch for mesh files (default: scene)");
        out.println("  -o, --open                Auto-open browser on startup");
        out.println();
        out.println("Sync Options:");
        out.println("      --ext <LIST>          Comma separated file extensions (default: .obj)");
        out.println("      --debounce-ms <MS>    Quiet period before a change is sent (default: 100)");
        out.println("      --queue-capacity <N>  Events buffered per viewer before resync (default: 256)");
        out.println("      --digest              Attach a SHA-256 content digest to each file");
        out.println("      --exit-on-quit        Stop the portal when a viewer quits");
        out.println("      --config <FILE>       JSON file overriding the default settings");
        out.println();
        out.println("Help:");
        out.println("  -h, --help                Show this help message");
        out.println("  -V, --version             Show version");
        out.println("      --help-keys           Show keyboard controls");
        out.println("      --help-settings       Show available settings");
    }

    /**
     * Validate parsed flags together with the resulting configuration and print any errors.
     */
    public static boolean validate(Config config, PortalConfiguration configuration, PrintStream out) {
        var errors = new ArrayList<>(config.errors);
        errors.addAll(configuration.getValidationErrors());
        if (!errors.isEmpty()) {
            out.println("Configuration errors:");
            for (var error : errors) {
                out.println("  - " + error);
            }
            out.println();
            out.println("Use 'kitbash-portal --help' for usage information.");
            return false;
        }
        return true;
    }
}
