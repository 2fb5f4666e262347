package com.demo.multisig.controller;

import com.demo.multisig.controller.dto.ValidatorDtos;
import com.demo.multisig.model.SigningPolicy;
import com.demo.multisig.model.Validator;
import com.demo.multisig.service.ValidatorRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/validators")
@RequiredArgsConstructor
public class ValidatorController {

    private final ValidatorRegistry registry;

    @GetMapping
    public List<Validator> list(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        return registry.listActive(userId);
    }

    @PostMapping
    public ResponseEntity<Validator> add(@RequestHeader(RequestHeaders.USER_ID) String userId,
                                         @Valid @RequestBody ValidatorDtos.AddRequest body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registry.add(userId, body.toValidator()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> remove(@RequestHeader(RequestHeaders.USER_ID) String userId,
                                       @PathVariable("id") String id) {
        registry.remove(userId, id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/policy")
    public SigningPolicy policy(@RequestHeader(RequestHeaders.USER_ID) String userId) {
        return registry.policy(userId);
    }

    @PutMapping("/policy")
    public SigningPolicy setPolicy(@RequestHeader(RequestHeaders.USER_ID) String userId,
                                   @Valid @RequestBody ValidatorDtos.PolicyRequest body) {
        return registry.setPolicy(userId, body.toPolicy());
    }

    @GetMapping("/requires-multisig")
    public Map<String, Object> requiresMultiSig(@RequestHeader(RequestHeaders.USER_ID) String userId,
                                                @RequestParam("value") BigDecimal value) {
        return Map.of("value", value, "requiresMultiSig", registry.requiresMultiSig(userId, value));
    }
}
