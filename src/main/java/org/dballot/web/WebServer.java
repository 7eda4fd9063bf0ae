package org.dballot.web;

import com.google.gson.Gson;
import org.dballot.config.BallotConfig;
import org.dballot.governance.BallotException;
import org.dballot.util.ConversionUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

import static spark.Spark.after;
import static spark.Spark.awaitInitialization;
import static spark.Spark.awaitStop;
import static spark.Spark.exception;
import static spark.Spark.get;
import static spark.Spark.ipAddress;
import static spark.Spark.notFound;
import static spark.Spark.port;
import static spark.Spark.post;
import static spark.Spark.stop;

/**
 * Route registration and error mapping for the ballot HTTP API.
 */
public final class WebServer {

    private static final Logger log = LoggerFactory.getLogger(WebServer.class);
    private static final Gson GSON = ConversionUtil.gson();

    private WebServer() {
    }

    public static void start(BallotConfig config, BallotHandler handler) {
        port(config.getPort());
        ipAddress(config.getHost());

        registerGlobalExceptionHandlers();
        registerRoutes(handler);

        after((request, response) -> response.type("application/json"));
        awaitInitialization();
        log.info("[WebServer] Listening on " + config.getHost() + ":" + config.getPort());
    }

    public static void shutdown() {
        stop();
        awaitStop();
    }

    private static void registerGlobalExceptionHandlers() {
        exception(BallotException.class, (error, request, response) -> {
            response.status(error.getError().httpStatus());
            response.type("application/json");
            response.body(errorBody(error.getError().name(), error.getMessage()));
        });

        exception(IllegalArgumentException.class, (error, request, response) -> {
            response.status(400);
            response.type("application/json");
            response.body(errorBody("INVALID_INPUT", error.getMessage()));
        });

        exception(Exception.class, (error, request, response) -> {
            log.error("[WebServer] Unhandled error on " + request.requestMethod() + " " + request.pathInfo(), error);
            response.status(500);
            response.type("application/json");
            response.body(errorBody("INTERNAL", "Internal server error"));
        });

        notFound((request, response) -> {
            response.type("application/json");
            return errorBody("NOT_FOUND", "No route for " + request.pathInfo());
        });
    }

    private static String errorBody(String kind, String message) {
        return GSON.toJson(Map.of("error", kind, "message", message == null ? "" : message));
    }

    private static void registerRoutes(BallotHandler handler) {
        get("/ballot/proposals", handler::listProposals, GSON::toJson);
        get("/ballot/proposals/:index", handler::proposal, GSON::toJson);
        get("/ballot/winner", handler::winner, GSON::toJson);
        get("/ballot/tally", handler::tally, GSON::toJson);

        post("/ballot/rights", handler::grantRights, GSON::toJson);
        post("/ballot/delegate", handler::delegate, GSON::toJson);
        post("/ballot/vote", handler::vote, GSON::toJson);
        get("/ballot/voted", handler::hasVoted, GSON::toJson);
        get("/ballot/voters", handler::voterInfo, GSON::toJson);
    }
}
