package com.roundtable;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: data and log locations, HTTP port, dev flag.
 */
public class AppConfig {

    private static final String APP_NAME = "RoundTable";
    static final String SESSIONS_DIR = "chatbot_sessions";
    static final String PROMPTS_DIR = "chatbot_prompts";

    private final Path dataPath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path dataPath, Path logPath, int port, boolean devMode) {
        this.dataPath = dataPath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    public Path getDataPath() {
        return dataPath;
    }

    public Path getSessionsPath() {
        return dataPath.resolve(SESSIONS_DIR);
    }

    public Path getPromptsPath() {
        return dataPath.resolve(PROMPTS_DIR);
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\RoundTable\logs
     * macOS: ~/Library/Logs/RoundTable
     * Linux: ~/.local/share/RoundTable/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("round-table.log");
    }

    /**
     * Find an available port, starting with the preferred port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }

        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }

        // Let the server fail later with a clear error
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path dataPath = null;
        private int preferredPort = 7860;
        private boolean devMode = false;

        public Builder dataPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.dataPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                if (arg.startsWith("--data-dir=")) {
                    dataPath(arg.substring("--data-dir=".length()));
                } else if ("--data-dir".equals(arg) && i + 1 < args.length) {
                    dataPath(args[++i]);
                } else if (arg.startsWith("--port=")) {
                    parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    parsePort(args[++i]);
                } else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private void parsePort(String value) {
            try {
                this.preferredPort = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + value, e);
            }
        }

        public AppConfig build() throws IOException {
            Path data = dataPath != null ? dataPath : Paths.get("").toAbsolutePath();
            Files.createDirectories(data.resolve(SESSIONS_DIR));
            Files.createDirectories(data.resolve(PROMPTS_DIR));

            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();

            return new AppConfig(data, logPath, port, devMode);
        }
    }
}
