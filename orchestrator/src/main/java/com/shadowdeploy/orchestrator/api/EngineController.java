package com.shadowdeploy.orchestrator.api;

import com.shadowdeploy.orchestrator.api.dto.EngineResponse;
import com.shadowdeploy.orchestrator.engine.EngineFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/** GET /engines: engines a deployment can currently be driven through. */
@RestController
@RequestMapping("/engines")
public class EngineController {

    private final EngineFactory engineFactory;

    public EngineController(EngineFactory engineFactory) {
        this.engineFactory = engineFactory;
    }

    @GetMapping
    public List<EngineResponse> availableEngines() {
        return engineFactory.availableEngines().stream()
                .map(name -> new EngineResponse(name, engineFactory.describe(name).orElse(name)))
                .toList();
    }
}
