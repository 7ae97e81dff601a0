package com.pwescrow.adapter.in.web;

import com.pwescrow.adapter.in.web.action.EscrowActionHandler;
import com.pwescrow.adapter.in.web.callback.CallbackHandler;
import com.pwescrow.adapter.in.web.form.EscrowFormHandler;
import com.pwescrow.adapter.in.web.query.EscrowQueryHandler;
import com.pwescrow.adapter.out.eventbus.EventBusEscrowEventPublisher;
import com.pwescrow.adapter.out.persistence.JdbcActionTokenPersistenceAdapter;
import com.pwescrow.adapter.out.persistence.JdbcEscrowLogPersistenceAdapter;
import com.pwescrow.adapter.out.persistence.JdbcEscrowPersistenceAdapter;
import com.pwescrow.adapter.out.persistence.JdbcUserPersistenceAdapter;
import com.pwescrow.adapter.out.persistence.SchemaInitializer;
import com.pwescrow.application.port.in.EscrowActionUseCase;
import com.pwescrow.application.port.in.EscrowFormUseCase;
import com.pwescrow.application.port.in.EscrowQueryUseCase;
import com.pwescrow.application.port.out.ActionTokenRepository;
import com.pwescrow.application.port.out.EscrowEventPublisher;
import com.pwescrow.application.port.out.EscrowLogRepository;
import com.pwescrow.application.port.out.EscrowRepository;
import com.pwescrow.application.port.out.UserRepository;
import com.pwescrow.application.service.ActionOfferPolicy;
import com.pwescrow.application.service.ActionTokenService;
import com.pwescrow.application.service.AgreementReconciler;
import com.pwescrow.application.service.EscrowFormParser;
import com.pwescrow.application.service.EscrowFormService;
import com.pwescrow.application.service.EscrowFormValidator;
import com.pwescrow.application.service.EscrowLifecycleService;
import com.pwescrow.application.service.EscrowQueryService;
import com.pwescrow.application.service.EscrowTransitioner;
import com.pwescrow.config.EscrowSettings;
import com.pwescrow.domain.model.TransitionGraph;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import io.vertx.jdbcclient.JDBCPool;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    private static final int DEFAULT_PORT = 8081;

    private final EscrowSettings settings;
    private final Clock clock;

    private JDBCPool jdbcPool;
    private EscrowFormHandler formHandler;
    private EscrowActionHandler actionHandler;
    private CallbackHandler callbackHandler;
    private EscrowQueryHandler queryHandler;

    public HttpServerVerticle(EscrowSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeDatabase()
                .compose(v -> {
                    log.info("Database initialized successfully");
                    return initializeServices();
                })
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", getPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop() {
        if (jdbcPool != null) {
            jdbcPool.close();
        }
        log.info("HTTP Server Verticle stopped");
    }

    private Future<Void> initializeDatabase() {
        JsonObject dbConfig = config().getJsonObject("database");
        if (dbConfig == null) {
            return Future.failedFuture("Database configuration not found in application.yml");
        }

        log.info("Connecting to database: {}", dbConfig.getString("url"));

        JsonObject poolConfig = new JsonObject()
                .put("url", dbConfig.getString("url"))
                .put("user", dbConfig.getString("user"))
                .put("password", dbConfig.getString("password"))
                .put("driver_class", dbConfig.getString("driver_class"))
                .put("max_pool_size", dbConfig.getInteger("max_pool_size", 10));

        jdbcPool = JDBCPool.pool(vertx, poolConfig);

        Future<Void> connected = jdbcPool.query("SELECT 1").execute()
                .onSuccess(result -> log.info("Database connection test successful"))
                .onFailure(error -> log.error("Database connection failed", error))
                .mapEmpty();

        if (dbConfig.getBoolean("init_schema", true)) {
            return connected.compose(v -> new SchemaInitializer(jdbcPool).initialize());
        }
        return connected;
    }

    private Future<Void> initializeServices() {
        // Output ports (adapters)
        EscrowRepository escrowRepository = new JdbcEscrowPersistenceAdapter(jdbcPool);
        ActionTokenRepository tokenRepository = new JdbcActionTokenPersistenceAdapter();
        EscrowLogRepository logRepository = new JdbcEscrowLogPersistenceAdapter(jdbcPool);
        UserRepository userRepository = new JdbcUserPersistenceAdapter(clock);
        EscrowEventPublisher eventPublisher = new EventBusEscrowEventPublisher(vertx);

        // Application services (use cases)
        TransitionGraph graph = TransitionGraph.standard();
        ActionTokenService tokenService = new ActionTokenService(tokenRepository, clock);
        EscrowTransitioner transitioner = new EscrowTransitioner(graph, escrowRepository, logRepository,
                tokenService, ActionOfferPolicy.standard(), settings, clock);

        EscrowActionUseCase actionUseCase = new EscrowLifecycleService(jdbcPool, escrowRepository, logRepository,
                tokenService, new AgreementReconciler(logRepository, clock), transitioner, graph, eventPublisher, clock);
        EscrowFormUseCase formUseCase = new EscrowFormService(jdbcPool, new EscrowFormValidator(), escrowRepository,
                logRepository, userRepository, transitioner, eventPublisher, settings, clock);
        EscrowQueryUseCase queryUseCase = new EscrowQueryService(escrowRepository, logRepository);

        // Input adapters (handlers)
        formHandler = new EscrowFormHandler(formUseCase, new EscrowFormParser());
        actionHandler = new EscrowActionHandler(actionUseCase);
        callbackHandler = new CallbackHandler(actionUseCase);
        queryHandler = new EscrowQueryHandler(queryUseCase);

        log.info("Services wired up (Hexagonal Architecture)");
        return Future.succeededFuture();
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());

        // Setup routes
        WebRouter webRouter = new WebRouter(router, formHandler, actionHandler, callbackHandler, queryHandler);
        webRouter.setupRoutes();

        // Default route - 404
        router.route().handler(ctx -> ctx.response()
                .setStatusCode(404)
                .putHeader("Content-Type", "application/json")
                .end(new JsonObject()
                        .put("status", "error")
                        .put("message", "Endpoint not found")
                        .encode()));

        int port = getPort();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(port)
                .onSuccess(server -> log.info("HTTP server listening on port {}", port))
                .mapEmpty();
    }

    private int getPort() {
        return config().getJsonObject("http", new JsonObject()).getInteger("port", DEFAULT_PORT);
    }
}
