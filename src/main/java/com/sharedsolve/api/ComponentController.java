package com.sharedsolve.api;

import com.sharedsolve.component.ComponentService;
import com.sharedsolve.component.model.ComponentType;
import com.sharedsolve.coordination.RoutedResult;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/components")
@Slf4j
public class ComponentController {

    private final ComponentService componentService;

    public ComponentController(ComponentService componentService) {
        this.componentService = componentService;
    }

    @PostMapping("/{type}")
    public ComponentResponse execute(@PathVariable String type, @Valid @RequestBody ComponentRequest request) {
        ComponentType componentType = ComponentType.fromKey(type);
        log.info("POST /api/components/{} - cid: {}, task: {}", componentType.key(), request.cid(), request.task());
        RoutedResult routed = componentService.execute(componentType, request.toTask());
        return ComponentResponse.from(request, componentType, routed);
    }
}
