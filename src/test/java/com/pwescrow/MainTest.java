package com.pwescrow;

import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void environmentVariablesOverrideYamlValues() {
        JsonObject config = new JsonObject()
                .put("database", new JsonObject().put("url", "jdbc:postgresql://localhost/pwescrow").put("user", "pwescrow"))
                .put("http", new JsonObject().put("port", 8081))
                .put("DATABASE_URL", "jdbc:postgresql://db:5432/escrow")
                .put("DATABASE_PASSWORD", "secret")
                .put("HTTP_PORT", "9090")
                .put("LOG_GROUP_ID", -100777L);

        JsonObject merged = Main.applyEnvironmentOverrides(config);

        assertEquals("jdbc:postgresql://db:5432/escrow", merged.getJsonObject("database").getString("url"));
        assertEquals("pwescrow", merged.getJsonObject("database").getString("user"));
        assertEquals("secret", merged.getJsonObject("database").getString("password"));
        assertEquals(9090, merged.getJsonObject("http").getInteger("port"));
        assertEquals("-100777", merged.getJsonObject("bot").getString("log_group_id"));
    }

    @Test
    void yamlValuesStayWhenNoEnvironmentOverride() {
        JsonObject config = new JsonObject()
                .put("http", new JsonObject().put("port", 8081))
                .put("bot", new JsonObject().put("log_group_id", "-100123"));

        JsonObject merged = Main.applyEnvironmentOverrides(config);

        assertEquals(8081, merged.getJsonObject("http").getInteger("port"));
        assertEquals("-100123", merged.getJsonObject("bot").getString("log_group_id"));
        assertTrue(merged.getJsonObject("database").isEmpty());
    }

    @Test
    void environmentStoreKeepsValuesAsRawStrings() {
        ConfigStoreOptions store = Main.environmentStore();

        assertEquals("env", store.getType());
        assertTrue(store.getConfig().getBoolean("raw-data"));
        assertTrue(store.getConfig().getJsonArray("keys").contains("DATABASE_PASSWORD"));
    }

    @Test
    void rawNumericLookingPasswordReachesTheDatabaseUnchanged() {
        JsonObject merged = Main.applyEnvironmentOverrides(new JsonObject().put("DATABASE_PASSWORD", "0123"));

        assertEquals("0123", merged.getJsonObject("database").getString("password"));
    }
}
