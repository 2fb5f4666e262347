package com.demo.multisig.controller;

import com.demo.multisig.controller.dto.ProposalDtos;
import com.demo.multisig.model.Proposal;
import com.demo.multisig.model.ProposalSignature;
import com.demo.multisig.model.ProposalStatus;
import com.demo.multisig.repository.ProposalQuery;
import com.demo.multisig.service.ExecutionCoordinator;
import com.demo.multisig.service.GasEstimate;
import com.demo.multisig.service.Preflight;
import com.demo.multisig.service.ProposalService;
import com.demo.multisig.service.SignatureCollector;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/multisig/proposals")
@RequiredArgsConstructor
public class ProposalController {

    private final ProposalService proposalService;
    private final SignatureCollector signatureCollector;
    private final ExecutionCoordinator executionCoordinator;

    @GetMapping
    public List<Proposal> list(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        ProposalStatus filter = status == null || status.isBlank() ? null : ProposalStatus.fromWire(status);
        return proposalService.listForUser(userId, new ProposalQuery(filter, limit, offset));
    }

    @PostMapping
    public ResponseEntity<Proposal> create(@RequestHeader(RequestHeaders.USER_ID) String userId,
                                           @Valid @RequestBody ProposalDtos.CreateRequest body) {
        Proposal created = proposalService.create(userId, body.toDraft());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    public Proposal get(@RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable("id") String id) {
        return proposalService.getForUser(id, userId);
    }

    // Creator-only; resolved proposals stay stored for audit
    @DeleteMapping("/{id}")
    public Proposal cancel(@RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable("id") String id) {
        return proposalService.cancel(id, userId);
    }

    @PostMapping("/{id}/sign")
    public ProposalDtos.SignResponse sign(@RequestHeader(RequestHeaders.USER_ID) String userId,
                                          @PathVariable("id") String id,
                                          @Valid @RequestBody ProposalDtos.SignRequest body) {
        return ProposalDtos.SignResponse.from(signatureCollector.sign(body.toCommand(id, userId)));
    }

    @GetMapping("/{id}/gas")
    public GasEstimate gas(@RequestHeader(RequestHeaders.USER_ID) String userId, @PathVariable("id") String id) {
        proposalService.getForUser(id, userId);
        return executionCoordinator.estimateGas(id);
    }

    @PostMapping("/preflight")
    public Preflight preflight(@RequestHeader(RequestHeaders.USER_ID) String userId,
                               @Valid @RequestBody ProposalDtos.PreflightRequest body) {
        proposalService.getForUser(body.proposalId, userId);
        List<ProposalSignature> candidates = body.signatures == null ? List.of()
                : body.signatures.stream().map(s -> s.toSignature(userId)).toList();
        return executionCoordinator.canExecute(body.proposalId, candidates);
    }
}
