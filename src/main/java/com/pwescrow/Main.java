package com.pwescrow;

import com.pwescrow.adapter.in.web.HttpServerVerticle;
import com.pwescrow.adapter.out.notification.EscrowMessageFormatter;
import com.pwescrow.adapter.out.notification.LoggingChatNotifier;
import com.pwescrow.adapter.out.notification.NotificationVerticle;
import com.pwescrow.adapter.out.notification.PaymentInstructions;
import com.pwescrow.config.EscrowSettings;
import com.pwescrow.domain.event.EscrowEvent;
import com.pwescrow.infrastructure.config.EscrowEventCodec;
import io.vertx.config.ConfigRetriever;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * Main application entry point
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        log.info("Starting PW Escrow Engine...");

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(10)
                .setEventLoopPoolSize(4);

        Vertx vertx = Vertx.vertx(options);

        // Register message codec for EscrowEvent
        vertx.eventBus().registerDefaultCodec(EscrowEvent.class, new EscrowEventCodec());
        log.info("Registered EscrowEvent message codec");

        loadConfig(vertx)
                .compose(config -> deploy(vertx, config))
                .onSuccess(v -> {
                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down PW Escrow Engine...");
                        vertx.close();
                    }));
                    log.info("PW Escrow Engine is ready!");
                })
                .onFailure(error -> {
                    log.error("Failed to start PW Escrow Engine", error);
                    vertx.close();
                });
    }

    private static Future<Void> deploy(Vertx vertx, JsonObject config) {
        EscrowSettings settings = EscrowSettings.fromConfig(config);
        Clock clock = Clock.systemUTC();

        EscrowMessageFormatter formatter = new EscrowMessageFormatter(settings, new PaymentInstructions(settings));
        NotificationVerticle notificationVerticle = new NotificationVerticle(formatter, new LoggingChatNotifier());
        HttpServerVerticle httpServerVerticle = new HttpServerVerticle(settings, clock);

        DeploymentOptions deploymentOptions = new DeploymentOptions().setConfig(config);

        return vertx.deployVerticle(notificationVerticle, deploymentOptions)
                .onSuccess(id -> log.info("Notification Verticle deployed successfully: {}", id))
                .compose(id -> vertx.deployVerticle(httpServerVerticle, deploymentOptions))
                .onSuccess(id -> log.info("HTTP Server Verticle deployed successfully: {}", id))
                .mapEmpty();
    }

    /**
     * application.yml from the classpath, then selected environment variables on top
     */
    static Future<JsonObject> loadConfig(Vertx vertx) {
        ConfigStoreOptions yamlStore = new ConfigStoreOptions()
                .setType("file")
                .setFormat("yaml")
                .setConfig(new JsonObject().put("path", "application.yml"));

        ConfigRetriever retriever = ConfigRetriever.create(vertx, new ConfigRetrieverOptions()
                .addStore(yamlStore)
                .addStore(environmentStore()));

        return retriever.getConfig()
                .map(Main::applyEnvironmentOverrides)
                .onSuccess(config -> log.info("Loaded configuration from application.yml"))
                .onFailure(error -> log.error("Failed to load application.yml: {}", error.getMessage()));
    }

    /**
     * Selected environment variables, kept as raw strings
     */
    static ConfigStoreOptions environmentStore() {
        return new ConfigStoreOptions()
                .setType("env")
                .setConfig(new JsonObject()
                        .put("raw-data", true)
                        .put("keys", new JsonArray()
                                .add("DATABASE_URL")
                                .add("DATABASE_USER")
                                .add("DATABASE_PASSWORD")
                                .add("HTTP_PORT")
                                .add("LOG_GROUP_ID")));
    }

    static JsonObject applyEnvironmentOverrides(JsonObject config) {
        JsonObject database = config.getJsonObject("database", new JsonObject());
        JsonObject http = config.getJsonObject("http", new JsonObject());
        JsonObject bot = config.getJsonObject("bot", new JsonObject());

        if (config.getValue("DATABASE_URL") != null) {
            database.put("url", config.getString("DATABASE_URL"));
        }
        if (config.getValue("DATABASE_USER") != null) {
            database.put("user", config.getString("DATABASE_USER"));
        }
        if (config.getValue("DATABASE_PASSWORD") != null) {
            database.put("password", config.getString("DATABASE_PASSWORD"));
        }
        if (config.getValue("HTTP_PORT") != null) {
            http.put("port", Integer.parseInt(String.valueOf(config.getValue("HTTP_PORT"))));
        }
        if (config.getValue("LOG_GROUP_ID") != null) {
            bot.put("log_group_id", String.valueOf(config.getValue("LOG_GROUP_ID")));
        }

        return config.put("database", database).put("http", http).put("bot", bot);
    }
}
