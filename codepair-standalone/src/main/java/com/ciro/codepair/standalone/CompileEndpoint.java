package com.ciro.codepair.standalone;

import com.ciro.codepair.standalone.exec.CodeExecutor;
import com.ciro.codepair.standalone.exec.CodeExecutors;
import com.ciro.codepair.standalone.exec.CompileException;
import com.ciro.codepair.standalone.exec.CompileRequest;
import com.ciro.codepair.standalone.exec.ExecutionResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * POST /compile con {"code": ..., "language": ...}.
 * <p>
 * La compilación bloquea, así que la petición se despacha fuera del hilo de IO.
 * 400 para errores del código del usuario, 500 para fallos de infraestructura.
 */
public final class CompileEndpoint implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(CompileEndpoint.class);

    private final ObjectMapper mapper;
    private final Validator validator; // puede ser null sin proveedor de validación
    private final CodeExecutors executors;
    private final long maxCodeBytes;

    public CompileEndpoint(ObjectMapper mapper, Validator validator, CodeExecutors executors, long maxCodeBytes) {
        this.mapper = mapper;
        this.validator = validator;
        this.executors = executors;
        this.maxCodeBytes = maxCodeBytes;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (!exchange.getRequestMethod().equals(Methods.POST)) {
            HttpReplies.text(exchange, StatusCodes.METHOD_NOT_ALLOWED, "Method not allowed");
            return;
        }
        if (exchange.isInIoThread()) {
            exchange.dispatch(this);
            return;
        }

        // margen para el envoltorio JSON
        exchange.setMaxEntitySize(maxCodeBytes + 4096);
        exchange.startBlocking();

        byte[] body;
        try {
            body = exchange.getInputStream().readAllBytes();
        } catch (IOException e) {
            log.debug("Cannot read compile request: {}", e.toString());
            HttpReplies.text(exchange, StatusCodes.BAD_REQUEST, "Invalid request body");
            return;
        }

        CompileRequest request;
        try {
            request = mapper.readValue(body, CompileRequest.class);
        } catch (JsonProcessingException e) {
            HttpReplies.text(exchange, StatusCodes.BAD_REQUEST, "Invalid JSON");
            return;
        } catch (IOException e) {
            log.error("Unexpected error parsing compile request", e);
            HttpReplies.text(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Internal error");
            return;
        }
        if (request == null) {
            HttpReplies.text(exchange, StatusCodes.BAD_REQUEST, "Invalid JSON");
            return;
        }

        String violations = violations(request);
        if (violations != null) {
            HttpReplies.text(exchange, StatusCodes.BAD_REQUEST, violations);
            return;
        }

        String language = request.languageOrDefault();
        Optional<CodeExecutor> executor = executors.forLanguage(language);
        if (executor.isEmpty()) {
            HttpReplies.text(exchange, StatusCodes.BAD_REQUEST, "Unsupported language: " + request.language());
            return;
        }

        try {
            ExecutionResult result = executor.get().execute(request.code());
            exchange.setStatusCode(StatusCodes.OK);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, result.contentType());
            exchange.getResponseSender().send(ByteBuffer.wrap(result.payload()));
        } catch (CompileException e) {
            exchange.setStatusCode(StatusCodes.BAD_REQUEST);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, ExecutionResult.TEXT);
            exchange.getResponseSender().send(e.diagnostics());
        } catch (IOException e) {
            log.error("{} execution failed", language, e);
            HttpReplies.text(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Execution failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            HttpReplies.text(exchange, StatusCodes.SERVICE_UNAVAILABLE, "Interrupted");
        }
    }

    private String violations(CompileRequest request) {
        if (validator != null) {
            Set<ConstraintViolation<CompileRequest>> found = validator.validate(request);
            if (!found.isEmpty()) {
                return found.stream()
                        .map(ConstraintViolation::getMessage)
                        .sorted()
                        .collect(Collectors.joining("\n"));
            }
        } else if (request.code() == null) {
            return "code is required";
        }
        // el límite es configurable, no cabe en una anotación
        if (request.code().getBytes(StandardCharsets.UTF_8).length > maxCodeBytes) {
            return "code exceeds " + maxCodeBytes + " bytes";
        }
        return null;
    }
}
