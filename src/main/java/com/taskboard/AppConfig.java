package com.taskboard;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Application configuration: storage location, log file and the chat backend settings.
 */
public class AppConfig {

    private static final String APP_NAME = "Taskboard";

    public static final String DEFAULT_CHAT_PROVIDER = "ollama";
    public static final String DEFAULT_CHAT_BASE_URL = "http://localhost:11434";
    public static final String DEFAULT_CHAT_MODEL = "llama3.2";
    public static final int DEFAULT_CHAT_TIMEOUT_MS = 120_000;
    public static final int DEFAULT_HISTORY_LIMIT = 50;

    private final Path dataDirectory;
    private final Path logPath;
    private final String chatProvider;
    private final String chatBaseUrl;
    private final String chatModel;
    private final String chatApiKey;
    private final int chatTimeoutMs;
    private final int historyLimit;
    private final boolean debug;

    private AppConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.logPath = builder.logPath;
        this.chatProvider = builder.chatProvider;
        this.chatBaseUrl = builder.chatBaseUrl;
        this.chatModel = builder.chatModel;
        this.chatApiKey = builder.chatApiKey;
        this.chatTimeoutMs = builder.chatTimeoutMs;
        this.historyLimit = builder.historyLimit;
        this.debug = builder.debug;
    }

    /**
     * Directory holding the JSON store files, or null for a memory-only setup.
     */
    public Path getDataDirectory() {
        return dataDirectory;
    }

    public Path getLogPath() {
        return logPath;
    }

    public String getChatProvider() {
        return chatProvider;
    }

    public String getChatBaseUrl() {
        return chatBaseUrl;
    }

    public String getChatModel() {
        return chatModel;
    }

    public String getChatApiKey() {
        return chatApiKey;
    }

    public int getChatTimeoutMs() {
        return chatTimeoutMs;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * Get the application data directory based on the operating system.
     * Windows: %APPDATA%\Taskboard
     * macOS: ~/Library/Application Support/Taskboard
     * Linux: ~/.local/share/Taskboard
     */
    public static Path getDefaultDataDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME);
        }
    }

    public static Path getDefaultLogPath() {
        return getDefaultDataDirectory().resolve("logs").resolve("taskboard.log");
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path dataDirectory = null;
        private Path logPath = null;
        private String chatProvider = DEFAULT_CHAT_PROVIDER;
        private String chatBaseUrl = DEFAULT_CHAT_BASE_URL;
        private String chatModel = DEFAULT_CHAT_MODEL;
        private String chatApiKey = null;
        private int chatTimeoutMs = DEFAULT_CHAT_TIMEOUT_MS;
        private int historyLimit = DEFAULT_HISTORY_LIMIT;
        private boolean debug = false;
        private boolean memoryOnly = false;

        public Builder dataDirectory(String path) {
            if (path != null && !path.isBlank()) {
                this.dataDirectory = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder dataDirectory(Path path) {
            this.dataDirectory = path;
            return this;
        }

        /**
         * Keep every store in memory; nothing is written to disk.
         */
        public Builder memoryOnly() {
            this.memoryOnly = true;
            return this;
        }

        public Builder logPath(Path logPath) {
            this.logPath = logPath;
            return this;
        }

        public Builder chatProvider(String provider) {
            if (provider != null && !provider.isBlank()) {
                this.chatProvider = provider.trim().toLowerCase();
            }
            return this;
        }

        public Builder chatBaseUrl(String baseUrl) {
            if (baseUrl != null && !baseUrl.isBlank()) {
                this.chatBaseUrl = baseUrl.trim();
            }
            return this;
        }

        public Builder chatModel(String model) {
            if (model != null && !model.isBlank()) {
                this.chatModel = model.trim();
            }
            return this;
        }

        public Builder chatApiKey(String apiKey) {
            this.chatApiKey = apiKey != null && !apiKey.isBlank() ? apiKey.trim() : null;
            return this;
        }

        public Builder chatTimeoutMs(int timeoutMs) {
            if (timeoutMs > 0) {
                this.chatTimeoutMs = timeoutMs;
            }
            return this;
        }

        public Builder historyLimit(int limit) {
            if (limit > 0) {
                this.historyLimit = limit;
            }
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        /**
         * Apply TASKBOARD_* and OLLAMA_* variables. Unparsable numbers keep their current value.
         */
        public Builder fromEnvironment(Map<String, String> env) {
            if (env == null) {
                return this;
            }
            dataDirectory(env.get("TASKBOARD_DATA_DIR"));
            chatProvider(env.get("TASKBOARD_CHAT_PROVIDER"));
            chatBaseUrl(env.get("OLLAMA_URL"));
            chatModel(env.get("OLLAMA_MODEL"));
            if (env.containsKey("TASKBOARD_CHAT_API_KEY")) {
                chatApiKey(env.get("TASKBOARD_CHAT_API_KEY"));
            }
            chatTimeoutMs(parseInt(env.get("TASKBOARD_CHAT_TIMEOUT_MS"), chatTimeoutMs));
            historyLimit(parseInt(env.get("TASKBOARD_HISTORY_LIMIT"), historyLimit));
            String debugFlag = env.get("TASKBOARD_DEBUG");
            if (debugFlag != null) {
                this.debug = "true".equalsIgnoreCase(debugFlag.trim()) || "1".equals(debugFlag.trim());
            }
            return this;
        }

        private static int parseInt(String value, int fallback) {
            if (value == null) {
                return fallback;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }

        public AppConfig build() {
            if (memoryOnly) {
                this.dataDirectory = null;
            } else if (dataDirectory == null) {
                this.dataDirectory = getDefaultDataDirectory().resolve("data");
            }
            if (logPath == null && !memoryOnly) {
                this.logPath = getDefaultLogPath();
            }
            return new AppConfig(this);
        }
    }
}
