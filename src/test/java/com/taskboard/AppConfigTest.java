package com.taskboard;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void defaultsPointAtLocalOllama() {
        AppConfig config = new AppConfig.Builder().fromEnvironment(new HashMap<>()).build();
        assertEquals("ollama", config.getChatProvider());
        assertEquals(AppConfig.DEFAULT_CHAT_BASE_URL, config.getChatBaseUrl());
        assertEquals(AppConfig.DEFAULT_CHAT_MODEL, config.getChatModel());
        assertEquals(AppConfig.DEFAULT_HISTORY_LIMIT, config.getHistoryLimit());
        assertNotNull(config.getDataDirectory());
        assertFalse(config.isDebug());
    }

    @Test
    void environmentOverridesDefaults() {
        Map<String, String> env = new HashMap<>();
        env.put("TASKBOARD_DATA_DIR", "/var/lib/taskboard");
        env.put("OLLAMA_URL", "http://gpu-box:11434");
        env.put("OLLAMA_MODEL", "mistral");
        env.put("TASKBOARD_CHAT_PROVIDER", "OpenAI");
        env.put("TASKBOARD_CHAT_API_KEY", " sk-test ");
        env.put("TASKBOARD_CHAT_TIMEOUT_MS", "5000");
        env.put("TASKBOARD_HISTORY_LIMIT", "10");
        env.put("TASKBOARD_DEBUG", "1");

        AppConfig config = new AppConfig.Builder().fromEnvironment(env).build();

        assertEquals(Paths.get("/var/lib/taskboard").toAbsolutePath().normalize(), config.getDataDirectory());
        assertEquals("http://gpu-box:11434", config.getChatBaseUrl());
        assertEquals("mistral", config.getChatModel());
        assertEquals("openai", config.getChatProvider());
        assertEquals("sk-test", config.getChatApiKey());
        assertEquals(5000, config.getChatTimeoutMs());
        assertEquals(10, config.getHistoryLimit());
        assertTrue(config.isDebug());
    }

    @Test
    void badNumbersKeepDefaults() {
        Map<String, String> env = new HashMap<>();
        env.put("TASKBOARD_CHAT_TIMEOUT_MS", "soon");
        env.put("TASKBOARD_HISTORY_LIMIT", "-3");

        AppConfig config = new AppConfig.Builder().fromEnvironment(env).build();

        assertEquals(AppConfig.DEFAULT_CHAT_TIMEOUT_MS, config.getChatTimeoutMs());
        assertEquals(AppConfig.DEFAULT_HISTORY_LIMIT, config.getHistoryLimit());
    }

    @Test
    void memoryOnlyHasNoDataDirectory() {
        AppConfig config = new AppConfig.Builder().dataDirectory("/tmp/ignored").memoryOnly().build();
        assertNull(config.getDataDirectory());
        assertNull(config.getLogPath());
    }
}
