package com.shadowdeploy.orchestrator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowdeploy.orchestrator.api.dto.ErrorResponse;
import com.shadowdeploy.orchestrator.engine.EngineFactory;
import com.shadowdeploy.orchestrator.engine.EngineSelection;
import com.shadowdeploy.orchestrator.engine.EngineSelectionException;
import com.shadowdeploy.orchestrator.engine.TransformationEngine;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Engine guard in front of POST /deployments.
 *
 * Resolves the engine from the X-Transform-Engine header, else the
 * {@code engine} query parameter, else the {@code engine} field of the JSON
 * body. The engine handed out by the factory is stored as request attribute
 * {@value #ENGINE_ATTRIBUTE} so the deployment reuses it; otherwise the request is answered with 400 and
 * {@code {error, message, availableEngines}} and never reaches the controller.
 */
@Component
public class EngineSelectionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(EngineSelectionFilter.class);

    public static final String ENGINE_ATTRIBUTE = "transformEngine";
    public static final String ENGINE_HEADER    = "X-Transform-Engine";
    public static final String ENGINE_PARAM     = "engine";

    private final EngineFactory engineFactory;
    private final ObjectMapper  objectMapper;

    public EngineSelectionFilter(EngineFactory engineFactory, ObjectMapper objectMapper) {
        this.engineFactory = engineFactory;
        this.objectMapper  = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !("POST".equalsIgnoreCase(request.getMethod())
                && ("/deployments".equals(path) || "/deployments/".equals(path)));
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        CachedBodyRequest wrapped = new CachedBodyRequest(request);

        String requested = EngineFactory.resolveRequestEngine(
                request.getHeader(ENGINE_HEADER),
                request.getParameter(ENGINE_PARAM),
                bodyEngine(wrapped.body()));

        try {
            TransformationEngine engine = engineFactory.create(EngineSelection.fromRequest(requested));
            wrapped.setAttribute(ENGINE_ATTRIBUTE, engine);
        } catch (EngineSelectionException e) {
            log.warn("Rejected deployment request ({}): {}", e.getReason(), e.getMessage());
            response.setStatus(HttpStatus.BAD_REQUEST.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            objectMapper.writeValue(response.getOutputStream(), ErrorResponse.of(e));
            return;
        }

        filterChain.doFilter(wrapped, response);
    }

    private String bodyEngine(byte[] body) {
        if (body.length == 0) {
            return null;
        }
        try {
            JsonNode field = objectMapper.readTree(body).path(ENGINE_PARAM);
            return field.isTextual() ? field.asText() : null;
        } catch (JsonProcessingException e) {
            // The controller rejects the malformed body itself.
            log.debug("Body is not JSON; no engine field: {}", e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            log.debug("Body could not be read for engine field: {}", e.getMessage());
            return null;
        }
    }

    /** Request whose body can be read again after the guard inspected it. */
    static final class CachedBodyRequest extends HttpServletRequestWrapper {

        private final byte[] body;

        CachedBodyRequest(HttpServletRequest request) throws IOException {
            super(request);
            this.body = request.getInputStream().readAllBytes();
        }

        byte[] body() {
            return body;
        }

        @Override
        public ServletInputStream getInputStream() {
            ByteArrayInputStream in = new ByteArrayInputStream(body);
            return new ServletInputStream() {
                @Override public boolean isFinished()                 { return in.available() == 0; }
                @Override public boolean isReady()                    { return true; }
                @Override public void setReadListener(ReadListener l) { throw new UnsupportedOperationException(); }
                @Override public int read()                           { return in.read(); }
            };
        }

        @Override
        public BufferedReader getReader() {
            String encoding = getCharacterEncoding();
            Charset charset = encoding != null ? Charset.forName(encoding) : StandardCharsets.UTF_8;
            return new BufferedReader(new InputStreamReader(getInputStream(), charset));
        }
    }
}
