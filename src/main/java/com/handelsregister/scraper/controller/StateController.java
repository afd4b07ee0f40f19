package com.handelsregister.scraper.controller;

import com.handelsregister.scraper.dto.StateInfo;
import com.handelsregister.scraper.exception.RequestValidationException;
import com.handelsregister.scraper.exception.StateNotFoundException;
import com.handelsregister.scraper.state.StateRegistry;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * State code lookups, no authentication.
 * <ul>
 *   <li><code>GET /api/bundesland?name=Bavaria</code> → {@code {"code":"BY","name_de":"Bayern",...}}</li>
 *   <li><code>GET /api/bundesland/list</code> → all sixteen states in portal order</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/bundesland")
@RequiredArgsConstructor
public class StateController {

    private final StateRegistry states;

    @GetMapping
    public StateInfo resolve(@RequestParam(value = "name", required = false) final String name) {
        if (StringUtils.isEmpty(name)) {
            throw new RequestValidationException("Missing required parameter: name");
        }
        return states.resolve(name)
                .map(code -> StateInfo.lookup(code, name))
                .orElseThrow(() -> new StateNotFoundException(name));
    }

    @GetMapping("/list")
    public List<StateInfo> list() {
        return states.list().stream().map(StateInfo::of).toList();
    }
}
